package com.primemath.backend.modules.maintenance.domain;

import java.util.List;
import java.util.Optional;

public final class GradeLadder {

    private static final List<String> LADDER = List.of(
            "초1", "초2", "초3", "초4", "초5", "초6",
            "중1", "중2", "중3",
            "고1", "고2", "고3"
    );

    private GradeLadder() {
    }

    public static Optional<String> next(String grade) {
        if (grade == null) {
            return Optional.empty();
        }
        int index = LADDER.indexOf(grade.trim());
        if (index < 0 || index == LADDER.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(LADDER.get(index + 1));
    }
}
