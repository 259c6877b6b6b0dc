package com.worklog.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worklog.aggregation.Report;
import com.worklog.config.ReportConfig;
import com.worklog.report.CsvReportExporter;
import com.worklog.report.JsonReportExporter;
import com.worklog.report.ReportExporter;
import com.worklog.storage.StorageException;
import com.worklog.tracking.EntryRequest;
import com.worklog.tracking.ErrorKind;
import com.worklog.tracking.TrackingException;
import com.worklog.tracking.WorklogEngine;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one command line against the engine and turns the outcome into an exit code.
 *
 * <pre>
 * start [activity]
 * stop
 * activity &lt;text&gt;
 * meeting-start &lt;title&gt; [type] [attendees]
 * meeting-stop &lt;meeting-id&gt;
 * entry &lt;minutes&gt; &lt;description&gt; [--day id] [--commit hash] [--jira ticket] [--tags a,b] [--project name]
 * status
 * report [--from yyyy-MM-dd --to yyyy-MM-dd] [--format csv|json]
 * </pre>
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_VALIDATION = 2;
    public static final int EXIT_CONFLICT = 3;
    public static final int EXIT_NOT_FOUND = 4;
    public static final int EXIT_INVALID_STATE = 5;

    private static final Set<String> ENTRY_OPTIONS = Set.of("day", "commit", "jira", "tags", "project");
    private static final Set<String> REPORT_OPTIONS = Set.of("from", "to", "format");

    private final WorklogEngine engine;
    private final String owner;
    private final ReportConfig reportConfig;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper;

    public CommandDispatcher(WorklogEngine engine, String owner, ReportConfig reportConfig,
                             PrintStream out, PrintStream err) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.owner = owner;
        this.reportConfig = reportConfig == null ? ReportConfig.defaults() : reportConfig.withDefaults();
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.mapper = JsonReportExporter.createMapper();
    }

    public int run(List<String> args) {
        if (args == null || args.isEmpty()) {
            err.println("Missing command. Try: start, stop, activity, meeting-start, meeting-stop, entry, status, report");
            return EXIT_VALIDATION;
        }
        String command = args.get(0).toLowerCase(Locale.ROOT);
        List<String> rest = args.subList(1, args.size());
        try {
            switch (command) {
                case "start" -> print(engine.startWorkDay(owner, rest.isEmpty() ? null : String.join(" ", rest)));
                case "stop" -> print(engine.stopWorkDay(owner));
                case "activity" -> print(engine.updateActivity(owner, String.join(" ", rest)));
                case "meeting-start" -> startMeeting(rest);
                case "meeting-stop" -> print(engine.stopMeeting(owner, parseId(single(rest, "meeting id"), "meeting id")));
                case "entry" -> addEntry(rest);
                case "status" -> print(engine.status(owner));
                case "report" -> report(rest);
                default -> throw TrackingException.validation("Unknown command: " + args.get(0));
            }
            return EXIT_OK;
        } catch (TrackingException ex) {
            log.debug("Command {} rejected: {}", command, ex.getMessage());
            err.println(ex.kind() + ": " + ex.getMessage());
            return exitCode(ex.kind());
        } catch (StorageException ex) {
            log.error("Storage failure while running {}", command, ex);
            err.println("Storage failure: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            log.error("Failed to write output for {}", command, ex);
            err.println("Output failure: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    static int exitCode(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> EXIT_VALIDATION;
            case CONFLICT -> EXIT_CONFLICT;
            case NOT_FOUND -> EXIT_NOT_FOUND;
            case INVALID_STATE -> EXIT_INVALID_STATE;
        };
    }

    private void startMeeting(List<String> args) throws TrackingException, StorageException, IOException {
        if (args.isEmpty() || args.size() > 3) {
            throw TrackingException.validation("Usage: meeting-start <title> [type] [attendees]");
        }
        String type = args.size() > 1 ? args.get(1) : null;
        int attendees = args.size() > 2 ? parseInt(args.get(2), "attendees") : 0;
        print(engine.startMeeting(owner, args.get(0), type, attendees));
    }

    private void addEntry(List<String> args) throws TrackingException, StorageException, IOException {
        ParsedArgs parsed = ParsedArgs.parse(args, ENTRY_OPTIONS);
        if (parsed.positional().size() < 2) {
            throw TrackingException.validation("Usage: entry <minutes> <description> [options]");
        }
        int minutes = parseInt(parsed.positional().get(0), "minutes");
        String description = String.join(" ", parsed.positional().subList(1, parsed.positional().size()));
        EntryRequest request = EntryRequest.of(description, minutes)
                .withCommitHash(parsed.option("commit"))
                .withJiraTicket(parsed.option("jira"))
                .withProject(parsed.option("project"));
        String day = parsed.option("day");
        if (day != null) {
            request = request.forWorkDay(parseId(day, "work day id"));
        }
        String tags = parsed.option("tags");
        if (tags != null) {
            request = request.withTags(Arrays.asList(StringUtils.split(tags, ',')));
        }
        print(engine.addEntry(owner, request));
    }

    private void report(List<String> args) throws TrackingException, StorageException, IOException {
        ParsedArgs parsed = ParsedArgs.parse(args, REPORT_OPTIONS);
        if (!parsed.positional().isEmpty()) {
            throw TrackingException.validation("Unexpected argument: " + parsed.positional().get(0));
        }
        String format = parsed.option("format") == null ? reportConfig.format() : parsed.option("format");
        if (!ReportConfig.isSupported(format)) {
            throw TrackingException.validation("Unsupported report format: " + format);
        }
        String from = parsed.option("from");
        String to = parsed.option("to");
        Report report;
        if (from == null && to == null) {
            report = engine.report(owner);
        } else {
            LocalDate fromDate = parseDate(from == null ? to : from, "from");
            LocalDate toDate = parseDate(to == null ? from : to, "to");
            report = engine.report(owner, fromDate, toDate);
        }
        out.print(exporter(format).export(report));
        out.flush();
    }

    private ReportExporter<String> exporter(String format) {
        return "csv".equalsIgnoreCase(format.trim())
                ? new CsvReportExporter()
                : new JsonReportExporter(mapper);
    }

    private void print(Object value) throws JsonProcessingException {
        out.println(mapper.writeValueAsString(value));
        out.flush();
    }

    private static String single(List<String> args, String name) throws TrackingException {
        if (args.size() != 1) {
            throw TrackingException.validation("Expected exactly one " + name);
        }
        return args.get(0);
    }

    private static int parseInt(String value, String name) throws TrackingException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw TrackingException.validation(name + " must be a whole number, got '" + value + "'");
        }
    }

    private static UUID parseId(String value, String name) throws TrackingException {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException ex) {
            throw TrackingException.validation("Invalid " + name + ": " + value);
        }
    }

    private static LocalDate parseDate(String value, String name) throws TrackingException {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw TrackingException.validation(name + " must be yyyy-MM-dd, got '" + value + "'");
        }
    }

    private record ParsedArgs(List<String> positional, Map<String, String> options) {

        static ParsedArgs parse(List<String> args, Set<String> allowed) throws TrackingException {
            List<String> positional = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            for (int i = 0; i < args.size(); i++) {
                String arg = args.get(i);
                if (!arg.startsWith("--")) {
                    positional.add(arg);
                    continue;
                }
                String name = arg.substring(2);
                if (!allowed.contains(name)) {
                    throw TrackingException.validation("Unknown option: " + arg);
                }
                if (i + 1 >= args.size()) {
                    throw TrackingException.validation("Missing value for " + arg);
                }
                options.put(name, args.get(++i));
            }
            return new ParsedArgs(positional, options);
        }

        String option(String name) {
            return options.get(name);
        }
    }
}
