package com.pagewatch.monitor.api;

public enum FetchErrorKind {
    UNREACHABLE,
    TIMEOUT,
    RENDER_FAILURE
}
