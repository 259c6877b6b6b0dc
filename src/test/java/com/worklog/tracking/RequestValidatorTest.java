package com.worklog.tracking;

import com.worklog.config.TrackingConfig;
import com.worklog.model.MeetingType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator(TrackingConfig.defaults());

    @Test
    void shouldTrimRequiredText() throws Exception {
        assertEquals("Standup", validator.title("  Standup\t"));
        assertEquals("alice", validator.owner(" alice "));
    }

    @Test
    void shouldTreatBlankOptionalTextAsAbsent() throws Exception {
        assertEquals(Optional.empty(), validator.activity("   "));
        assertEquals(Optional.empty(), validator.jiraTicket(Optional.of("")));
        assertEquals(Optional.of("OPS-7"), validator.jiraTicket(Optional.of(" OPS-7 ")));
    }

    @Test
    void shouldEnforceLengthLimits() throws Exception {
        assertEquals(200, validator.title("t".repeat(200)).length());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(TrackingException.class, () -> validator.title("t".repeat(201))).kind());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(TrackingException.class, () -> validator.description("d".repeat(1001))).kind());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(TrackingException.class, () -> validator.activity("a".repeat(501))).kind());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(TrackingException.class, () -> validator.jiraTicket(Optional.of("J".repeat(51)))).kind());
    }

    @Test
    void shouldHonourConfiguredLimits() throws Exception {
        RequestValidator strict = new RequestValidator(
                new TrackingConfig(null, null, 10, null, null, null, null, 60).withDefaults());

        assertEquals(60, strict.durationMinutes(60));
        assertThrows(TrackingException.class, () -> strict.durationMinutes(61));
        assertThrows(TrackingException.class, () -> strict.title("eleven chars"));
    }

    @Test
    void shouldRejectBlankOwner() {
        assertThrows(TrackingException.class, () -> validator.owner(null));
        assertThrows(TrackingException.class, () -> validator.owner(" "));
    }

    @Test
    void shouldDefaultMissingMeetingTypeToOther() throws Exception {
        assertEquals(MeetingType.OTHER, validator.meetingType(null));
        assertEquals(MeetingType.TRAINING, validator.meetingType("Training"));
        assertThrows(TrackingException.class, () -> validator.meetingType("lunch"));
    }

    @Test
    void shouldAcceptZeroAttendees() throws Exception {
        assertEquals(0, validator.attendeeCount(0));
        assertThrows(TrackingException.class, () -> validator.attendeeCount(-1));
    }
}
