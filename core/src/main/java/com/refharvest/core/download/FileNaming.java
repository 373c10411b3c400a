package com.refharvest.core.download;

import com.refharvest.core.model.Placement;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL → 싱크 내 상대 이름. 모든 세그먼트는 [A-Za-z0-9._-] 외 문자를 '_'로 바꾼다. */
public final class FileNaming {
    private FileNaming() {}

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern CD_EXT = Pattern.compile("filename\\*\\s*=\\s*([^']*)'[^']*'([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CD_PLAIN = Pattern.compile("filename\\s*=\\s*(\"([^\"]*)\"|[^;]+)", Pattern.CASE_INSENSITIVE);

    public static String sanitize(String segment) {
        if (segment == null || segment.isEmpty()) return "_";
        String s = UNSAFE.matcher(segment).replaceAll("_");
        if (s.equals(".") || s.equals("..")) return "_";
        return s;
    }

    /**
     * URL 경로의 마지막 세그먼트(확장자 포함)를 파일 이름으로.
     * 없거나 '.'이 없으면 file= 쿼리 파라미터, 그것도 없으면 null.
     */
    public static String fileNameOf(URI url) {
        if (url == null) return null;
        String path = url.getPath();
        if (path != null && !path.isEmpty() && !path.endsWith("/")) {
            String last = path.substring(path.lastIndexOf('/') + 1);
            if (!last.isEmpty() && last.contains(".")) return last;
        }
        String q = url.getRawQuery();
        if (q != null) {
            for (String pair : q.split("&")) {
                int eq = pair.indexOf('=');
                if (eq <= 0) continue;
                if (pair.substring(0, eq).equalsIgnoreCase("file")) {
                    String v = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                    v = v.substring(v.lastIndexOf('/') + 1);
                    if (!v.isBlank()) return v;
                }
            }
        }
        return null;
    }

    /**
     * MIRRORED: 경로 세그먼트마다 디렉터리 + fileName, FLAT: fileName만.
     * fileName이 URL의 마지막 세그먼트와 같으면 디렉터리에서 제외된다.
     */
    public static String nameFor(URI url, Placement placement, String fileName) {
        String file = sanitize(fileName);
        if (placement == Placement.FLAT || url == null) return file;

        List<String> dirs = new ArrayList<>();
        String path = url.getPath() == null ? "" : url.getPath();
        String[] parts = path.split("/");
        int last = path.endsWith("/") ? parts.length : parts.length - 1; // 마지막 세그먼트는 파일 자리
        for (int i = 0; i < last; i++) {
            if (!parts[i].isEmpty()) dirs.add(sanitize(parts[i]));
        }
        if (dirs.isEmpty()) return file;
        return String.join("/", dirs) + "/" + file;
    }

    /** Content-Disposition의 filename*(RFC 5987) 또는 filename. 없으면 null. */
    public static String fromContentDisposition(String header) {
        if (header == null || header.isBlank()) return null;
        Matcher ext = CD_EXT.matcher(header);
        if (ext.find()) {
            String v = decodeExtValue(ext.group(1), ext.group(2));
            if (v != null) return baseName(v);
        }
        Matcher plain = CD_PLAIN.matcher(header);
        if (plain.find()) {
            String v = plain.group(2) != null ? plain.group(2) : plain.group(1).trim();
            return baseName(v);
        }
        return null;
    }

    /** RFC 5987 값 디코딩. 잘못된 charset/인코딩이면 null → filename 폴백 */
    private static String decodeExtValue(String charset, String value) {
        try {
            Charset cs = (charset == null || charset.isBlank()) ? StandardCharsets.UTF_8 : Charset.forName(charset.trim());
            return URLDecoder.decode(value.trim(), cs);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String baseName(String v) {
        if (v == null) return null;
        String s = v.replace('\\', '/');
        s = s.substring(s.lastIndexOf('/') + 1).trim();
        return s.isEmpty() ? null : s;
    }
}
