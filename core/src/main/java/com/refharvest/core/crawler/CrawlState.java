package com.refharvest.core.crawler;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실행 단위 상태: 방문 집합(페이지로 가져온 URL)과 다운로드 집합(파일로 가져온 URL).
 * 두 집합은 서로 독립이며 엔진 인스턴스가 소유한다. 전역 상태 없음.
 */
public final class CrawlState {
    private final Set<URI> visited = ConcurrentHashMap.newKeySet();
    private final Set<URI> downloaded = ConcurrentHashMap.newKeySet();

    public boolean isVisited(URI u) { return visited.contains(u); }

    /** 처음이면 true(표시함), 이미 방문했으면 false */
    public boolean markVisited(URI u) { return visited.add(u); }

    public int visitedCount() { return visited.size(); }

    public boolean isDownloaded(URI u) { return downloaded.contains(u); }

    /** 파일 시도 선점. 처음이면 true. 결과(성공/스킵/실패)와 무관하게 한 번만 가져온다. */
    public boolean claimDownload(URI u) { return downloaded.add(u); }

    public Set<URI> visitedSnapshot() { return new LinkedHashSet<>(visited); }
}
