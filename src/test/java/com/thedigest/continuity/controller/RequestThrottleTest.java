package com.thedigest.continuity.controller;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RequestThrottleTest {

    @Test
    void keysOnFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        assertThat(RequestThrottle.callerKey(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void throttlesEachCallerSeparately() {
        RequestThrottle throttle = new RequestThrottle(0.01);
        MockHttpServletRequest first = new MockHttpServletRequest();
        first.setRemoteAddr("198.51.100.1");
        MockHttpServletRequest second = new MockHttpServletRequest();
        second.setRemoteAddr("198.51.100.2");

        assertThat(throttle.tryAcquire(first)).isTrue();
        assertThat(throttle.tryAcquire(first)).isFalse();
        assertThat(throttle.tryAcquire(second)).isTrue();
    }

    @Test
    void nonPositiveRateDisablesThrottling() {
        RequestThrottle throttle = new RequestThrottle(0);
        MockHttpServletRequest request = new MockHttpServletRequest();

        for (int i = 0; i < 50; i++) {
            assertThat(throttle.tryAcquire(request)).isTrue();
        }
    }
}
