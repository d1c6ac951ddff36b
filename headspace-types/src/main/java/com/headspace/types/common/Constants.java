package com.headspace.types.common;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 指纹参与计算的文本前缀长度 */
    public final static int FINGERPRINT_TEXT_PREFIX = 200;

    /** 指纹十六进制长度 */
    public final static int FINGERPRINT_HEX_LENGTH = 16;

}
