package org.csits.reportd.manager.security;

/**
 * HMAC 签名抽象，用于对象存储请求和共享链接签名。
 */
public interface HmacSigner {

    byte[] hmacSha256(byte[] key, byte[] data);

    /**
     * 以 Base64 编码的密钥对 UTF-8 字符串签名，返回 Base64 结果。
     */
    String signBase64(String base64Key, String stringToSign);
}
