package com.refharvest.core.error;

import java.net.URI;

/** HTML 파싱 불가. 해당 노드만 막다른 길로 처리한다. */
public class ParseFailureException extends HarvestException {
    public ParseFailureException(URI resource, Throwable cause) {
        super(resource, "could not parse HTML for " + resource, cause);
    }
}
