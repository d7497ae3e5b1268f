package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.engine.SelectableNode;
import com.narrative.sge.graph.StoryNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Presents options to the player and follows the selected one.
 *
 * On entry the node filters its declared choices by their condition variable
 * (missing or unreadable variables count as available), optionally shuffles
 * them with the run's random source, and stores the presented order in temp
 * data. Selections index that presented list and are mapped back to the
 * declared choice, so shuffling never changes which port a selection follows.
 *
 * Selecting a choice:
 * - assigns the choice's {@code setVariable} if it has one,
 * - records the declared index in the variable {@code choice_<nodeId>},
 * - stores the choice as temp data under {@link #LAST_CHOICE_KEY}.
 *
 * With {@code choiceTimeout > 0} the engine falls back after the timeout to
 * the default choice if it is presented, else to the first presented choice.
 */
@Log4j2
public class ChoiceNode extends StoryNode implements SelectableNode {
    public static final String LAST_CHOICE_KEY = "lastChoice";
    static final String PRESENTED_KEY = "presentedChoices";

    private String promptText = "";
    private final List<Choice> choices = new ArrayList<>();
    private float choiceTimeout;
    private int defaultChoiceIndex = -1;
    private boolean shuffleChoices;
    private int nextChoiceSeq;

    public ChoiceNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
    }

    @Override
    public String typeName() {
        return "Choice";
    }

    @Override
    public String category() {
        return "Dialogue";
    }

    // ---- Authoring ----

    public Choice addChoice(String text) {
        return addChoice(text, null);
    }

    public Choice addChoice(String text, String conditionVariable) {
        String choiceId;
        do {
            choiceId = "choice_" + nextChoiceSeq++;
        } while (getOutputPort(choiceId) != null);
        return addChoice(new Choice(choiceId, text).setConditionVariable(conditionVariable));
    }

    /** Adds a choice and its output port. */
    public Choice addChoice(Choice choice) {
        addOutputPort(choice.id(), "Choice " + (choices.size() + 1) + ": " + choice.text());
        choices.add(choice);
        return choice;
    }

    public boolean removeChoice(int declaredIndex) {
        if (declaredIndex < 0 || declaredIndex >= choices.size())
            return false;
        choices.remove(declaredIndex);
        clearOutputPorts();
        for (int i = 0; i < choices.size(); i++)
            addOutputPort(choices.get(i).id(), "Choice " + (i + 1) + ": " + choices.get(i).text());
        return true;
    }

    public List<Choice> choices() {
        return Collections.unmodifiableList(choices);
    }

    // ---- Execution ----

    @Override
    public void onEnter(ExecutionContext context) {
        context.setTempData(PRESENTED_KEY, computePresented(context));
    }

    private int[] computePresented(ExecutionContext context) {
        List<Integer> available = new ArrayList<>(choices.size());
        for (int i = 0; i < choices.size(); i++)
            if (isAvailable(choices.get(i), context))
                available.add(i);
        if (shuffleChoices)
            Collections.shuffle(available, context.random());
        int[] presented = new int[available.size()];
        for (int i = 0; i < presented.length; i++)
            presented[i] = available.get(i);
        return presented;
    }

    private static boolean isAvailable(Choice choice, ExecutionContext context) {
        String variable = choice.conditionVariable();
        return variable == null || variable.isEmpty() || context.getBool(variable, true);
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        return NodeResult.waitForInput();
    }

    /** Declared indexes of the presented choices, in presented order. */
    public int[] presentedIndexes(ExecutionContext context) {
        int[] presented = context.getTempData(PRESENTED_KEY, (int[]) null);
        if (presented == null) {
            presented = computePresented(context);
            context.setTempData(PRESENTED_KEY, presented);
        }
        return presented;
    }

    /** The choices shown to the player in this visit, in presented order. */
    public List<Choice> presentedChoices(ExecutionContext context) {
        int[] presented = presentedIndexes(context);
        List<Choice> result = new ArrayList<>(presented.length);
        for (int i : presented)
            result.add(choices.get(i));
        return result;
    }

    @Override
    public int presentedCount(ExecutionContext context) {
        return presentedIndexes(context).length;
    }

    @Override
    public String select(ExecutionContext context, int presentedIndex) {
        int[] presented = presentedIndexes(context);
        if (presentedIndex < 0 || presentedIndex >= presented.length)
            return null;
        return applyChoice(context, presented[presentedIndex]);
    }

    @Override
    public Duration selectionTimeout() {
        return choiceTimeout > 0 ? Duration.ofNanos((long) (choiceTimeout * 1_000_000_000L)) : Duration.ZERO;
    }

    @Override
    public String selectFallback(ExecutionContext context) {
        int[] presented = presentedIndexes(context);
        for (int declared : presented)
            if (declared == defaultChoiceIndex)
                return applyChoice(context, declared);
        return presented.length > 0 ? applyChoice(context, presented[0]) : null;
    }

    /**
     * Applies the side effects of the choice at {@code declaredIndex} and
     * returns its port.
     */
    public String applyChoice(ExecutionContext context, int declaredIndex) {
        Choice choice = choices.get(declaredIndex);
        if (choice.setVariable() != null && !choice.setVariable().isEmpty())
            context.setVariable(choice.setVariable(), choice.setValue());
        context.setTempData(LAST_CHOICE_KEY, choice);
        context.setVariable("choice_" + id(), declaredIndex);
        log.debug("Choice {} selected at {}", declaredIndex, this);
        return choice.id();
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if (choices.isEmpty())
            errors.add("Choice node has no choices");
        if (defaultChoiceIndex >= choices.size())
            errors.add("Default choice index " + defaultChoiceIndex + " is out of range (" + choices.size()
                    + " choices)");
        return errors;
    }

    // ---- Configuration ----

    public String promptText() {
        return promptText;
    }

    public void setPromptText(String promptText) {
        this.promptText = promptText;
    }

    /** Seconds before the fallback selection applies; zero or less disables it. */
    public float choiceTimeout() {
        return choiceTimeout;
    }

    public void setChoiceTimeout(float seconds) {
        this.choiceTimeout = seconds;
    }

    public int defaultChoiceIndex() {
        return defaultChoiceIndex;
    }

    public void setDefaultChoiceIndex(int defaultChoiceIndex) {
        this.defaultChoiceIndex = defaultChoiceIndex;
    }

    public boolean isShuffleChoices() {
        return shuffleChoices;
    }

    public void setShuffleChoices(boolean shuffleChoices) {
        this.shuffleChoices = shuffleChoices;
    }
}
