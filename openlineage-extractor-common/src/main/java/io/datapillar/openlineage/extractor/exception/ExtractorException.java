package io.datapillar.openlineage.extractor.exception;

/**
 * Extractor 运行时异常
 * <p>
 * 契约层面的错误（未声明支持类型、类型不匹配、注册失败）统一继承此类，向调用方传播
 */
public class ExtractorException extends RuntimeException {

    public ExtractorException(String message, Object... args) {
        super(format(message, args));
    }

    public ExtractorException(Throwable cause, String message, Object... args) {
        super(format(message, args), cause);
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
