package org.carball.pgsight.caller;

/**
 * Minimal view of a stack frame used by the caller filters.
 */
public record CallerFrame(String className, String fileName, int lineNumber, String methodName) {

    public static CallerFrame from(StackWalker.StackFrame frame) {
        return new CallerFrame(frame.getClassName(), frame.getFileName(), frame.getLineNumber(), frame.getMethodName());
    }

    public static CallerFrame from(StackTraceElement element) {
        return new CallerFrame(element.getClassName(), element.getFileName(), element.getLineNumber(),
                element.getMethodName());
    }

    /**
     * Source path derived from the package and file name, e.g. {@code com/shop/OrderRepository.java}.
     */
    public String path() {
        int lastDot = className.lastIndexOf('.');
        String packagePath = lastDot > 0 ? className.substring(0, lastDot).replace('.', '/') : "";
        String file = fileName != null ? fileName : simpleClassName() + ".java";
        return packagePath.isEmpty() ? file : packagePath + "/" + file;
    }

    private String simpleClassName() {
        String simple = className.substring(className.lastIndexOf('.') + 1);
        int nested = simple.indexOf('$');
        return nested > 0 ? simple.substring(0, nested) : simple;
    }
}
