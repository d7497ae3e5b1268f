package com.narrative.sge.engine;

import com.narrative.sge.api.StoryCondition;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Evaluates a fixed set of conditions over many independent contexts.
 *
 * Hosts use this to re-check trigger conditions for every active run in one
 * pass. Each context is only read, and contexts never share variable storage,
 * so with {@code parallel} enabled the contexts are spread over the common
 * fork-join pool. Callers must not mutate the contexts while a batch runs.
 */
public final class ConditionBatch {
    private final StoryCondition[] conditions;
    private final boolean parallel;

    public ConditionBatch(List<StoryCondition> conditions, boolean parallel) {
        if (conditions == null || conditions.isEmpty())
            throw new IllegalArgumentException("A batch needs at least one condition");
        this.conditions = conditions.toArray(new StoryCondition[0]);
        this.parallel = parallel;
    }

    public static ConditionBatch sequential(List<StoryCondition> conditions) {
        return new ConditionBatch(conditions, false);
    }

    public static ConditionBatch parallel(List<StoryCondition> conditions) {
        return new ConditionBatch(conditions, true);
    }

    public boolean isParallel() {
        return parallel;
    }

    public int conditionCount() {
        return conditions.length;
    }

    /**
     * @return {@code result[i][j]}: condition j evaluated on context i. A null
     *         context yields all false.
     */
    public boolean[][] evaluate(List<ExecutionContext> contexts) {
        boolean[][] results = new boolean[contexts.size()][];
        range(contexts.size()).forEach(i -> results[i] = evaluateOne(contexts.get(i)));
        return results;
    }

    /** @return per context, whether every condition holds */
    public boolean[] evaluateAll(List<ExecutionContext> contexts) {
        boolean[] results = new boolean[contexts.size()];
        range(contexts.size()).forEach(i -> results[i] = allHold(contexts.get(i)));
        return results;
    }

    private IntStream range(int n) {
        IntStream s = IntStream.range(0, n);
        return parallel ? s.parallel() : s;
    }

    private boolean[] evaluateOne(ExecutionContext context) {
        boolean[] r = new boolean[conditions.length];
        if (context == null)
            return r;
        for (int j = 0; j < conditions.length; j++)
            r[j] = conditions[j].test(context.variables());
        return r;
    }

    private boolean allHold(ExecutionContext context) {
        if (context == null)
            return false;
        for (StoryCondition c : conditions)
            if (!c.test(context.variables()))
                return false;
        return true;
    }
}
