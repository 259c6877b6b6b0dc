package com.worklog.aggregation;

import com.worklog.model.MeetingType;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Totals for one or more work days. Computed on demand and never stored.
 *
 * <p>{@code totalMinutes} is the plain sum of meeting and entry minutes; overlap between manual
 * entries and meetings is not removed. Tag buckets overlap too: an entry with two tags counts fully
 * under both.
 */
public record Report(
        List<UUID> workDayIds,
        int totalMinutes,
        int meetingMinutes,
        int entryMinutes,
        int meetingCount,
        Map<String, Integer> breakdownByTag,
        Map<String, Integer> breakdownByProject,
        Map<MeetingType, Integer> breakdownByMeetingType,
        List<MeetingSummary> meetings,
        List<EntrySummary> entries
) {

    public Report {
        workDayIds = List.copyOf(workDayIds);
        Objects.requireNonNull(breakdownByTag, "breakdownByTag");
        Objects.requireNonNull(breakdownByProject, "breakdownByProject");
        Objects.requireNonNull(breakdownByMeetingType, "breakdownByMeetingType");
        meetings = List.copyOf(meetings);
        entries = List.copyOf(entries);
    }
}
