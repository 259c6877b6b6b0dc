package com.worklog.aggregation;

import com.worklog.model.Meeting;
import com.worklog.model.MeetingType;
import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Builds {@link Report}s from work day aggregates. Pure: the same input always yields an equal
 * report and nothing is cached between calls.
 */
public class ReportAggregator {

    public Report buildReport(WorkDay workDay) {
        Objects.requireNonNull(workDay, "workDay");
        return buildReport(List.of(workDay));
    }

    public Report buildReport(Collection<WorkDay> workDays) {
        Objects.requireNonNull(workDays, "workDays");

        List<UUID> ids = new ArrayList<>();
        List<MeetingSummary> meetings = new ArrayList<>();
        List<EntrySummary> entries = new ArrayList<>();
        Map<String, Integer> byTag = new TreeMap<>();
        Map<String, Integer> byProject = new TreeMap<>();
        Map<MeetingType, Integer> byMeetingType = new EnumMap<>(MeetingType.class);
        int meetingMinutes = 0;
        int entryMinutes = 0;

        for (WorkDay day : workDays) {
            ids.add(day.id());
            for (Meeting meeting : day.meetings()) {
                MeetingSummary summary = MeetingSummary.of(meeting);
                meetings.add(summary);
                if (!meeting.isRunning()) {
                    meetingMinutes += summary.durationMinutes();
                    byMeetingType.merge(meeting.meetingType(), summary.durationMinutes(), Integer::sum);
                }
            }
            for (TimeEntry entry : day.entries()) {
                entries.add(EntrySummary.of(entry));
                entryMinutes += entry.durationMinutes();
                for (String tag : entry.tags()) {
                    byTag.merge(tag, entry.durationMinutes(), Integer::sum);
                }
                entry.project().ifPresent(project ->
                        byProject.merge(project, entry.durationMinutes(), Integer::sum));
            }
        }

        // List.sort is stable, so equal timestamps keep insertion order.
        meetings.sort(Comparator.comparing(MeetingSummary::startedAt));
        entries.sort(Comparator.comparing(EntrySummary::recordedAt));

        return new Report(
                ids,
                meetingMinutes + entryMinutes,
                meetingMinutes,
                entryMinutes,
                meetings.size(),
                Collections.unmodifiableMap(byTag),
                Collections.unmodifiableMap(byProject),
                Collections.unmodifiableMap(byMeetingType),
                meetings,
                entries);
    }
}
