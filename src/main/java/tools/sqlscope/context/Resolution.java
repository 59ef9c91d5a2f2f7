package tools.sqlscope.context;

import java.util.List;
import java.util.Optional;

/**
 * 三态解析结果：唯一命中、未命中、多个候选。
 * 调用方按 {@link Status} 分支处理，不用异常表达“不知道”。
 */
public record Resolution<T>(Status status, List<T> candidates) {

    public enum Status {
        MATCHED,
        NO_MATCH,
        AMBIGUOUS
    }

    public Resolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        if (status == Status.MATCHED && candidates.size() != 1) {
            throw new IllegalArgumentException("MATCHED 必须恰好有一个候选");
        }
        if (status == Status.AMBIGUOUS && candidates.size() < 2) {
            throw new IllegalArgumentException("AMBIGUOUS 至少需要两个候选");
        }
    }

    public static <T> Resolution<T> matched(T value) {
        return new Resolution<>(Status.MATCHED, List.of(value));
    }

    public static <T> Resolution<T> noMatch() {
        return new Resolution<>(Status.NO_MATCH, List.of());
    }

    public static <T> Resolution<T> ambiguous(List<T> candidates) {
        return new Resolution<>(Status.AMBIGUOUS, candidates);
    }

    /**
     * 按候选数量自动选择状态。
     */
    public static <T> Resolution<T> of(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return noMatch();
        }
        if (candidates.size() == 1) {
            return matched(candidates.get(0));
        }
        return ambiguous(candidates);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public boolean isAmbiguous() {
        return status == Status.AMBIGUOUS;
    }

    public boolean isNoMatch() {
        return status == Status.NO_MATCH;
    }

    public Optional<T> value() {
        return isMatched() ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
