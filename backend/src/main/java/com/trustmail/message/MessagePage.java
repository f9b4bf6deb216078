package com.trustmail.message;

import java.util.List;

/**
 * One page of matching message ids. {@code nextPageToken} is null on the last page.
 */
public record MessagePage(List<String> ids, String nextPageToken) {

    public MessagePage {
        ids = List.copyOf(ids);
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
