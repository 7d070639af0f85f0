package com.reviewroster.scheduler.reviewer.service.selection;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public record SelectionRequest(int count, Set<String> excludes, boolean urgent, boolean hideBusy) {

    public SelectionRequest {
        if (count < 0) throw new IllegalArgumentException("invalid_count");
        excludes = excludes == null
                ? Set.of()
                : excludes.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public static SelectionRequest of(int count, Collection<String> excludes, boolean urgent, boolean hideBusy) {
        return new SelectionRequest(count, excludes == null ? null : new HashSet<>(excludes), urgent, hideBusy);
    }
}
