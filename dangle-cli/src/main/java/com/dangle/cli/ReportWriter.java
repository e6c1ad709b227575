package com.dangle.cli;

import com.dangle.ast.SourceLocation;
import com.dangle.engine.report.BugReport;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.PrintWriter;
import java.util.List;

/**
 * 报告输出：文本（编译器诊断风格）或 JSON
 */
public abstract class ReportWriter {

    protected final PrintWriter out;

    protected ReportWriter(PrintWriter out) {
        this.out = out;
    }

    public static ReportWriter text(PrintWriter out) {
        return new TextWriter(out);
    }

    public static ReportWriter json(PrintWriter out) {
        return new JsonWriter(out);
    }

    public abstract void write(List<AnalyzeRunner.UnitResult> units);

    /**
     * {@code file:line:col: warning: message [checker]}，最后一行为汇总
     */
    static final class TextWriter extends ReportWriter {
        TextWriter(PrintWriter out) {
            super(out);
        }

        @Override
        public void write(List<AnalyzeRunner.UnitResult> units) {
            int total = 0;
            for (AnalyzeRunner.UnitResult unit : units) {
                for (BugReport report : unit.getReports()) {
                    out.println(report.getLocation() + ": warning: " + report.getDescription()
                            + " [" + report.getBugType().getCheckerName() + "]");
                    total++;
                }
            }
            out.println(total + " warning" + (total == 1 ? "" : "s") + " in "
                    + units.size() + " unit" + (units.size() == 1 ? "" : "s") + ".");
            out.flush();
        }
    }

    static final class JsonWriter extends ReportWriter {
        private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

        JsonWriter(PrintWriter out) {
            super(out);
        }

        @Override
        public void write(List<AnalyzeRunner.UnitResult> units) {
            JsonObject root = new JsonObject();
            JsonArray unitArray = new JsonArray();
            int total = 0;
            for (AnalyzeRunner.UnitResult unit : units) {
                JsonObject u = new JsonObject();
                u.addProperty("file", unit.getFileName());
                u.addProperty("arc", unit.isArc());
                JsonArray reports = new JsonArray();
                for (BugReport report : unit.getReports()) {
                    reports.add(toJson(report));
                    total++;
                }
                u.add("reports", reports);
                unitArray.add(u);
            }
            root.add("units", unitArray);
            root.addProperty("total", total);
            out.println(gson.toJson(root));
            out.flush();
        }

        private static JsonObject toJson(BugReport report) {
            JsonObject r = new JsonObject();
            SourceLocation loc = report.getLocation();
            r.addProperty("checker", report.getBugType().getCheckerName());
            r.addProperty("bugType", report.getBugType().getName());
            r.addProperty("category", report.getBugType().getCategory());
            r.addProperty("file", loc.getFile());
            r.addProperty("line", loc.getLine());
            r.addProperty("column", loc.getColumn());
            r.addProperty("declaration", report.getDeclaration());
            r.addProperty("message", report.getDescription());
            return r;
        }
    }
}
