package com.skillgraph.audit.report;

import com.skillgraph.audit.report.ReportModels.AuditReport;

public interface ReportRenderer {

    ReportFormat format();

    String render(AuditReport report);
}
