package com.bm25index.storage;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 严格的 UTF-8 编码：遇到孤立代理项直接报错，不做 '?' 替换。
 *
 * String.getBytes(UTF_8) 会把孤立代理项静默替换为 '?'，两个不同的词项可能写成同一串字节，
 * 解码时被判定为重复词项，因此写入索引的键与词项必须经过此处。
 */
public final class StrictUtf8 {

    private StrictUtf8() {
    }

    /**
     * 判断字符串能否无损编码为 UTF-8，即不含孤立的高/低代理项。
     */
    public static boolean isEncodable(CharSequence value) {
        int length = value.length();
        for (int index = 0; index < length; index++) {
            char current = value.charAt(index);
            if (Character.isHighSurrogate(current)) {
                if (index + 1 >= length || !Character.isLowSurrogate(value.charAt(index + 1))) {
                    return false;
                }
                index++;
            } else if (Character.isLowSurrogate(current)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 校验字符串可以写入索引。
     *
     * @param value 键或词项
     * @param field 出错时报告的字段名
     * @throws IllegalArgumentException 含孤立代理项时抛出
     */
    public static void requireEncodable(String value, String field) {
        if (!isEncodable(value)) {
            throw new IllegalArgumentException(field + " 含孤立代理项，无法无损编码为 UTF-8: " + escape(value));
        }
    }

    /**
     * 创建报告错误的编码器。编码器有状态，不能跨线程共享。
     */
    static CharsetEncoder newEncoder() {
        return StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /**
     * 使用给定编码器编码。
     *
     * @throws IllegalArgumentException 字符串无法无损编码时抛出
     */
    static byte[] encode(CharsetEncoder encoder, String value, String field) {
        ByteBuffer encoded;
        try {
            encoded = encoder.encode(CharBuffer.wrap(value));
        } catch (CharacterCodingException exception) {
            throw new IllegalArgumentException(field + " 无法无损编码为 UTF-8: " + escape(value), exception);
        }
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }

    /**
     * 代理项以 \\uXXXX 形式输出，避免异常消息本身再次乱码。
     */
    private static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int index = 0; index < value.length(); index++) {
            char current = value.charAt(index);
            if (Character.isSurrogate(current)) {
                escaped.append(String.format("\\u%04X", (int) current));
            } else {
                escaped.append(current);
            }
        }
        return escaped.toString();
    }
}
