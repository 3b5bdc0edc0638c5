package com.sqllint.reflow;

/**
 * 换行重排计算失败
 */
public class ReflowException extends RuntimeException {

    public ReflowException(String message) {
        super(message);
    }
}
