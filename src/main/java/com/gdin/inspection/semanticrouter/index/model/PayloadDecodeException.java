package com.gdin.inspection.semanticrouter.index.model;

/**
 * 存储在文档里的序列化字段无法解析
 */
public class PayloadDecodeException extends Exception {

    public PayloadDecodeException(String message) {
        super(message);
    }

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
