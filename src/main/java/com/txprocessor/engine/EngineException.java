package com.txprocessor.engine;

/**
 * 引擎运行失败 (输入读取失败、Actor 异常退出等)
 */
public class EngineException extends RuntimeException {
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
