package com.dangle.engine.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 报告汇集点。同一编译单元内，类型、位置、消息都相同的报告只保留一条
 * （同一位置可能被多条路径重复检出）。
 */
public class BugReporter {
    private static final Logger LOG = Logger.getLogger(BugReporter.class.getName());

    private final List<BugReport> reports = new ArrayList<>();

    public void emitReport(BugReport report) {
        for (BugReport existing : reports) {
            if (existing.isDuplicateOf(report)) {
                LOG.finer(() -> "重复报告已忽略: " + report.getLocation());
                return;
            }
        }
        reports.add(report);
    }

    public List<BugReport> getReports() {
        return Collections.unmodifiableList(reports);
    }
}
