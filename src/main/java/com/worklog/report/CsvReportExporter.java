package com.worklog.report;

import com.worklog.aggregation.EntrySummary;
import com.worklog.aggregation.MeetingSummary;
import com.worklog.aggregation.Report;
import com.worklog.model.Durations;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public class CsvReportExporter implements ReportExporter<String> {

    static final String HEADER = String.join(",",
            "kind",
            "id",
            "work_day_id",
            "label",
            "category",
            "started_at",
            "ended_at",
            "minutes",
            "duration",
            "tags",
            "jira_ticket",
            "commit_hash",
            "project");

    private static final String LINE_SEPARATOR = "\n";

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public String export(Report report) {
        Objects.requireNonNull(report, "report");
        StringBuilder csv = new StringBuilder(HEADER).append(LINE_SEPARATOR);
        for (MeetingSummary meeting : report.meetings()) {
            csv.append(toCsv(meeting)).append(LINE_SEPARATOR);
        }
        for (EntrySummary entry : report.entries()) {
            csv.append(toCsv(entry)).append(LINE_SEPARATOR);
        }
        csv.append(String.join(",",
                "total", "", "", "", "", "", "",
                Integer.toString(report.totalMinutes()),
                escape(Durations.format(report.totalMinutes())),
                "", "", "", "")).append(LINE_SEPARATOR);
        return csv.toString();
    }

    private String toCsv(MeetingSummary meeting) {
        return String.join(",",
                "meeting",
                meeting.id().toString(),
                meeting.workDayId().toString(),
                escape(meeting.title()),
                escape(meeting.meetingType().label()),
                meeting.startedAt().toString(),
                meeting.stoppedAt().map(Instant::toString).orElse(""),
                Integer.toString(meeting.durationMinutes()),
                escape(meeting.formattedDuration()),
                "",
                "",
                "",
                "");
    }

    private String toCsv(EntrySummary entry) {
        return String.join(",",
                "entry",
                entry.id().toString(),
                entry.workDayId().toString(),
                escape(entry.description()),
                "",
                entry.recordedAt().toString(),
                "",
                Integer.toString(entry.durationMinutes()),
                escape(entry.formattedDuration()),
                escape(String.join(";", entry.tags())),
                escape(entry.jiraTicket()),
                escape(entry.commitHash()),
                escape(entry.project()));
    }

    private String escape(Optional<String> value) {
        return escape(value.orElse(""));
    }

    static String escape(String value) {
        if (StringUtils.isEmpty(value)) {
            return "";
        }
        if (StringUtils.containsAny(value, ',', '"', '\n', '\r')) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
