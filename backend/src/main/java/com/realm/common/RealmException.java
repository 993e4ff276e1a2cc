package com.realm.common;

/**
 * 核心层统一异常基类
 * 生成器与模拟器抛出的所有业务异常都继承此类，附带一个稳定的错误码
 */
public class RealmException extends RuntimeException {

    private final String code;

    public RealmException(String message, String code) {
        super(message);
        this.code = code;
    }

    public RealmException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
