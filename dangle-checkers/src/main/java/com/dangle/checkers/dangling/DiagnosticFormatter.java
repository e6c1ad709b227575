package com.dangle.checkers.dangling;

/**
 * 报告文本
 */
public final class DiagnosticFormatter {
    public static final String BUG_TYPE_NAME = "Leaking unsafe reference to self";
    public static final String CATEGORY = "Memory error";

    private DiagnosticFormatter() {}

    /**
     * @param fieldName 实例变量名
     * @param property  未清除的 assign 属性
     * @param className 实例变量声明的类名，id 类型为 null
     * @param context   报告上下文（如 "ARC-generated dealloc"），可为 null 或空
     */
    public static String format(String fieldName, String property, String className, String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Leaking unsafe reference to self stored in ").append(fieldName).append('.').append(property);
        if (context != null && !context.isEmpty()) {
            sb.append(" (in ").append(context).append(')');
        }
        sb.append(". ");

        sb.append("The assign property '").append(property).append("' of the ");
        if (className != null && !className.isEmpty()) {
            sb.append("instance of ").append(className);
        } else {
            sb.append("object");
        }
        sb.append(" stored in '").append(fieldName).append("' appears to occasionally point to self. ");

        sb.append("For memory safety, you need to clear this property explicitly before losing reference ")
                .append("to this object, typically by adding a line: '")
                .append(fieldName).append('.').append(property).append(" = nil;'. ");

        sb.append("In case of a false warning, consider adding an assert instead: 'FBAssert(")
                .append(fieldName).append('.').append(property).append(" != self);' or, if applicable: 'FBAssert(!")
                .append(fieldName).append(");'.");
        return sb.toString();
    }
}
