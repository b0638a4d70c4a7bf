package com.hhplus.furniture.presentation.common;

public final class SessionHeaders {

    public static final String SESSION_TOKEN = "X-SESSION-TOKEN";

    private SessionHeaders() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
