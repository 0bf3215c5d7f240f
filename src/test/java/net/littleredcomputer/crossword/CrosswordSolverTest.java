package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.time.Duration;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static net.littleredcomputer.crossword.TestPuzzles.*;
import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class CrosswordSolverTest {

    private static void assertSolves(Crossword c, Assignment a) {
        assertThat(a.isComplete(c), is(true));
        assertThat(new ConsistencyChecker(c).consistent(a), is(true));
        for (String w : a.asMap().values()) assertTrue(w + " is not a candidate", c.words().contains(w));
    }

    @Test
    public void frameHasOneFill() {
        assertThat(fill(new CrosswordSolver(frame()).solve()), is(ImmutableMap.of(
                frameTop, "HELLO", frameBottom, "TOTAL", frameLeft, "HAT", frameRight, "OWL")));
    }

    @Test
    public void crossingAtLastLetter() {
        Optional<Assignment> a = new CrosswordSolver(corner("CAT\nDOG\nTAP\n")).solve();
        assertThat(fill(a), is(ImmutableMap.of(cornerAcross, "CAT", cornerDown, "TAP")));
    }

    @Test
    public void crossingAtMiddleLetter() {
        // CAT/ACE, TAP/ACE and ACE/CAT all fit; the down slot has fewer candidates and goes
        // first, taking ACE, which rules out fewer across words than CAT does.
        Crossword c = tee("CAT\nDOG\nTAP\nACE\n");
        Optional<Assignment> a = new CrosswordSolver(c).solve();
        assertThat(fill(a), is(ImmutableMap.of(teeAcross, "CAT", teeDown, "ACE")));
        assertSolves(c, a.get());
    }

    @Test
    public void noLetterInCommonAtTheCrossing() {
        assertThat(new CrosswordSolver(tee("CAT\nDOG\nTAP\n")).solve(), isEmpty());
        CrosswordSolver s = new CrosswordSolver(corner("CAT\nBOX\n"));
        assertThat(s.solve(), isEmpty());
        assertThat(s.nodeCount(), is(0L));
    }

    @Test
    public void isolatedSlot() {
        Crossword c = Crossword.parseFrom("___\n", "cat\ndogs\na\nox\n");
        Variable v = new Variable(0, 0, ACROSS, 3);
        CrosswordSolver s = new CrosswordSolver(c);
        assertThat(fill(s.solve()), is(ImmutableMap.of(v, "CAT")));
        assertThat(s.domains().get(v), contains("CAT"));
    }

    @Test
    public void noWordOfTheRightLength() {
        CrosswordSolver s = new CrosswordSolver(Crossword.parseFrom("____\n", "cat\ndog\n"));
        assertThat(s.solve(), isEmpty());
        assertThat(s.nodeCount(), is(0L));
    }

    @Test
    public void wordsAreUsedOnlyOnce() {
        Variable top = new Variable(0, 0, ACROSS, 3);
        Variable bottom = new Variable(2, 0, ACROSS, 3);
        CrosswordSolver one = new CrosswordSolver(Crossword.parseFrom("___\n###\n___\n", "cat\n"));
        assertThat(one.solve(), isEmpty());
        assertThat(one.nodeCount(), is(2L));
        assertThat(one.backtrackCount(), is(2L));
        assertThat(fill(new CrosswordSolver(Crossword.parseFrom("___\n###\n___\n", "cat\ndog\n")).solve()),
                is(ImmutableMap.of(top, "CAT", bottom, "DOG")));
    }

    @Test
    public void gridWithoutSlotsIsTriviallySolved() {
        assertThat(fill(new CrosswordSolver(Crossword.parseFrom("_#\n#_\n", "cat\n")).solve()),
                is(ImmutableMap.<Variable, String>of()));
    }

    @Test
    public void squareIsFilledSoundly() {
        Crossword c = square();
        Optional<Assignment> a = new CrosswordSolver(c).solve();
        assertThat(a, isPresent());
        assertSolves(c, a.get());
    }

    @Test
    public void solvingIsDeterministic() {
        Crossword c = square();
        CrosswordSolver s = new CrosswordSolver(c);
        Optional<Assignment> first = s.solve();
        long nodes = s.nodeCount();
        assertThat(s.solve(), is(first));
        assertThat(s.nodeCount(), is(nodes));
        assertThat(new CrosswordSolver(square()).solve(), is(first));
    }

    @Test
    public void forwardCheckingFindsTheSameFills() {
        assertThat(new CrosswordSolver(frame()).setInference(CrosswordSolver.Inference.FORWARD_CHECKING).solve(),
                is(new CrosswordSolver(frame()).solve()));
        assertThat(fill(new CrosswordSolver(tee("CAT\nDOG\nTAP\nACE\n")).setInference(CrosswordSolver.Inference.FORWARD_CHECKING).solve()),
                is(ImmutableMap.of(teeAcross, "CAT", teeDown, "ACE")));
        assertThat(new CrosswordSolver(Crossword.parseFrom("___\n###\n___\n", "cat\n"))
                .setInference(CrosswordSolver.Inference.FORWARD_CHECKING).solve(), isEmpty());
    }

    @Test
    public void forwardCheckingFillsSquareSoundly() {
        Crossword c = square();
        Optional<Assignment> a = new CrosswordSolver(c).setInference(CrosswordSolver.Inference.FORWARD_CHECKING).solve();
        assertThat(a, isPresent());
        assertSolves(c, a.get());
    }

    @Test(expected = SearchTimeoutException.class)
    public void timeLimit() {
        new CrosswordSolver(square()).setTimeLimit(Duration.ZERO).solve();
    }

    @Test
    public void unsolvableBeatsTimeLimit() {
        // Proven unsolvable before the search starts, so the limit never comes into play.
        assertThat(new CrosswordSolver(corner("CAT\nBOX\n")).setTimeLimit(Duration.ZERO).solve(), isEmpty());
    }

    @Test
    public void reportsProgressWhileSearching() {
        CrosswordSolver s = new CrosswordSolver(square()).setLogInterval(Duration.ZERO).setLogCheckNodes(1);
        assertThat(s.solve(), isPresent());
        assertThat(s.nodeCount() > 0, is(true));
        assertThat(s.progressReports(), is(s.nodeCount()));
    }

    @Test
    public void progressIsQuietBetweenIntervals() {
        CrosswordSolver s = new CrosswordSolver(square()).setLogInterval(Duration.ofDays(1)).setLogCheckNodes(1);
        s.solve();
        assertThat(s.progressReports(), is(0L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void logCheckIntervalMustBePositive() {
        new CrosswordSolver(square()).setLogCheckNodes(0);
    }

    private static ImmutableMap<Variable, String> fill(Optional<Assignment> a) {
        assertThat(a, isPresent());
        return a.get().asMap();
    }
}
