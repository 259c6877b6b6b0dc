package com.worklog.report;

import com.worklog.aggregation.Report;

import java.io.IOException;

public interface ReportExporter<T> {

    String format();

    T export(Report report) throws IOException;
}
