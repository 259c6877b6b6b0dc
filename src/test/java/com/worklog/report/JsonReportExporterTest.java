package com.worklog.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.worklog.aggregation.Report;
import com.worklog.aggregation.ReportAggregator;
import com.worklog.model.Meeting;
import com.worklog.model.MeetingType;
import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonReportExporterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Test
    void shouldWriteTotalsBreakdownsAndIsoTimestamps() throws Exception {
        WorkDay day = WorkDay.create("alice", Optional.empty()).start(T0);
        Meeting meeting = Meeting.start(day.id(), "Retro", MeetingType.RETROSPECTIVE, 6, T0).stop(T0.plusSeconds(2700));
        TimeEntry entry = new TimeEntry(UUID.randomUUID(), day.id(), "Docs", 20, T0.plusSeconds(3000),
                Optional.empty(), Optional.empty(), Optional.empty(), Set.of("docs"));
        Report report = new ReportAggregator().buildReport(day.withMeeting(meeting).withEntry(entry));

        String json = new JsonReportExporter().export(report);
        JsonNode root = JsonReportExporter.createMapper().readTree(json);

        assertEquals(65, root.get("totalMinutes").asInt());
        assertEquals(45, root.get("meetingMinutes").asInt());
        assertEquals(1, root.get("meetingCount").asInt());
        assertEquals(20, root.get("breakdownByTag").get("docs").asInt());
        assertEquals(45, root.get("breakdownByMeetingType").get("RETROSPECTIVE").asInt());
        assertEquals(day.id().toString(), root.get("workDayIds").get(0).asText());
        JsonNode meetingNode = root.get("meetings").get(0);
        assertEquals("2024-03-01T09:00:00Z", meetingNode.get("startedAt").asText());
        assertEquals("2024-03-01T09:45:00Z", meetingNode.get("stoppedAt").asText());
        assertEquals("45m", meetingNode.get("formattedDuration").asText());
        assertTrue(root.get("entries").get(0).get("jiraTicket").isNull());
    }
}
