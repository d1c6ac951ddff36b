package com.headspace.domain.turn.model.valobj;

import com.google.common.hash.Hashing;
import com.headspace.types.common.Constants;
import com.headspace.types.enums.TurnActorEnum;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 回合内容指纹：sha256("actor:" + 去首尾空白后前 200 字符的小写) 的前 16 位十六进制。
 * <p>
 * 先去空白再截断，钩子文本与转录文本首尾空白不同也得到同一指纹。
 * </p>
 */
public final class TurnFingerprint {

    private TurnFingerprint() {
    }

    public static String of(TurnActorEnum actor, String text) {
        if (actor == null) {
            throw new IllegalArgumentException("Actor cannot be null");
        }
        String stripped = text == null ? "" : text.strip();
        String prefix = stripped.length() > Constants.FINGERPRINT_TEXT_PREFIX
                ? stripped.substring(0, Constants.FINGERPRINT_TEXT_PREFIX)
                : stripped;
        String normalized = prefix.toLowerCase(Locale.ROOT);
        String hex = Hashing.sha256()
                .hashString(actor.code() + ":" + normalized, StandardCharsets.UTF_8)
                .toString();
        return hex.substring(0, Constants.FINGERPRINT_HEX_LENGTH);
    }
}
