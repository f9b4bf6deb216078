package com.trustmail.trust;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Members found for each group token. A group that could not be resolved maps to an
 * empty list.
 */
public record ResolvedGroupMembers(Map<String, List<String>> membersByToken) {

    public ResolvedGroupMembers {
        membersByToken = Collections.unmodifiableMap(new LinkedHashMap<>(membersByToken));
    }

    public static ResolvedGroupMembers empty() {
        return new ResolvedGroupMembers(Map.of());
    }

    public List<String> membersOf(String groupToken) {
        return membersByToken.getOrDefault(groupToken, List.of());
    }

    public List<String> allMembers() {
        List<String> all = new ArrayList<>();
        membersByToken.values().forEach(all::addAll);
        return all;
    }
}
