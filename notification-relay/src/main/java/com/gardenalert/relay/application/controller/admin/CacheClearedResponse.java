package com.gardenalert.relay.application.controller.admin;

public record CacheClearedResponse(int clearedEntries) {}
