package com.refharvest.core.model;

import java.net.URI;
import java.util.Objects;

/** Downloader 한 건의 결과. FAILURE면 cause가 채워진다. */
public final class DownloadOutcome {

    public enum Status { SUCCESS, SKIP, FAILURE }

    private final URI url;
    private final String name;
    private final Status status;
    private final long bytes;
    private final String reason;
    private final Exception cause;

    private DownloadOutcome(URI url, String name, Status status, long bytes, String reason, Exception cause) {
        this.url = Objects.requireNonNull(url, "url");
        this.name = name;
        this.status = Objects.requireNonNull(status, "status");
        this.bytes = bytes;
        this.reason = reason;
        this.cause = cause;
    }

    public static DownloadOutcome success(URI url, String name, long bytes) {
        return new DownloadOutcome(url, name, Status.SUCCESS, bytes, null, null);
    }

    public static DownloadOutcome skip(URI url, String name, String reason) {
        return new DownloadOutcome(url, name, Status.SKIP, 0, reason, null);
    }

    public static DownloadOutcome failure(URI url, String name, Exception cause) {
        return new DownloadOutcome(url, name, Status.FAILURE, 0,
                cause == null ? "unknown" : cause.getMessage(), cause);
    }

    public URI getUrl() { return url; }
    /** 싱크 내 상대 이름(예: "docs/report.pdf"). 정해지기 전에 끝났으면 null. */
    public String getName() { return name; }
    public Status getStatus() { return status; }
    public long getBytes() { return bytes; }
    public String getReason() { return reason; }
    public Exception getCause() { return cause; }

    public boolean isSuccess() { return status == Status.SUCCESS; }
    public boolean isSkip() { return status == Status.SKIP; }
    public boolean isFailure() { return status == Status.FAILURE; }

    @Override public String toString() {
        return status + " " + url + (name != null ? " -> " + name : "")
                + (status == Status.SUCCESS ? " (" + bytes + " bytes)" : (reason != null ? " [" + reason + "]" : ""));
    }
}
