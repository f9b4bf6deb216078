package com.trustmail.message;

import java.util.List;

public record MessageListing(List<MessageSummary> messages, String nextPageToken) {}
