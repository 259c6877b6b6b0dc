package com.worklog.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MeetingTypeTest {

    @Test
    void shouldParseLeniently() {
        assertEquals(Optional.of(MeetingType.STANDUP), MeetingType.parse("standup"));
        assertEquals(Optional.of(MeetingType.ONE_ON_ONE), MeetingType.parse(" One-On-One "));
        assertEquals(Optional.of(MeetingType.CLIENT_CALL), MeetingType.parse("client call"));
    }

    @Test
    void shouldRejectUnknownOrBlankValues() {
        assertTrue(MeetingType.parse("party").isEmpty());
        assertTrue(MeetingType.parse("  ").isEmpty());
        assertTrue(MeetingType.parse(null).isEmpty());
    }

    @Test
    void labelShouldBeLowerCaseName() {
        assertEquals("retrospective", MeetingType.RETROSPECTIVE.label());
    }
}
