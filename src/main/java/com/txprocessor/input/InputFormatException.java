package com.txprocessor.input;

/**
 * 输入文件整体格式错误 (缺少或错误的表头)，属于致命错误
 */
public class InputFormatException extends RuntimeException {
    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
