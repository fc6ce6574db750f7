package com.example.pdfcrop.exception;

/**
 * 会话不存在或已被回收
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("会话不存在或已过期: " + sessionId);
    }
}
