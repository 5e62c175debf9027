package hobogo.rules;

import hobogo.contracts.PositionCodec;
import hobogo.impl.PositionCodecImpl;
import hobogo.records.Action;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Stream;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PerftTest {

  /* ── wiring ───────────────────────────────────────────────────── */
  private static final PositionCodec CODEC = new PositionCodecImpl();

  /* ── per‑test‑case record ─────────────────────────────────────── */
  private record TestCase(String position, int depth, long expected) {}

  private List<TestCase> cases;
  private long nodes = 0, timeNs = 0;

  /* ── load the perft vectors once (from /perft/hobogo.txt) ─────── */
  @BeforeAll
  void loadVectors() throws Exception {
    cases = new ArrayList<>();
    try (InputStream is = getClass().getResourceAsStream("/perft/hobogo.txt");
         BufferedReader br =
                 new BufferedReader(new InputStreamReader(Objects.requireNonNull(is), StandardCharsets.UTF_8))) {

      br.lines()
              .map(String::trim)
              .filter(l -> !(l.isEmpty() || l.startsWith("#")))
              .forEach(
                      l -> {
                        String[] p = l.split(";");
                        if (p.length < 3) return;
                        cases.add(
                                new TestCase(
                                        p[0].trim(),
                                        Integer.parseInt(p[1].replaceAll("[^0-9]", "")),
                                        Long.parseLong(p[2].replaceAll("[^0-9]", ""))));
                      });
    }
    Assertions.assertFalse(cases.isEmpty(), "no perft vectors found");
  }

  /* ── JUnit parameter source ───────────────────────────────────── */
  Stream<TestCase> caseStream() {
    return cases.stream();
  }

  @ParameterizedTest(name = "perft {index}")
  @MethodSource("caseStream")
  void perft(TestCase tc) {
    GameState root = CODEC.fromText(tc.position);

    long t0 = System.nanoTime();
    long got = perft(root, tc.depth);
    timeNs += System.nanoTime() - t0;
    nodes += got;
    Assertions.assertEquals(tc.expected, got, () -> "mismatch depth=" + tc.depth + " position=" + tc.position);
  }

  /* ── aggregate speed report ───────────────────────────────────── */
  @AfterAll
  void report() {
    double s = timeNs / 1_000_000_000.0;
    System.out.printf("PERFT : %,d nodes  %.3f s  %,d NPS%n", nodes, s, (long) (nodes / Math.max(1e-9, s)));
  }

  /* ── recursive walker; a finished game is one leaf ────────────── */
  private static long perft(GameState state, int depth) {
    if (depth == 0 || state.isTerminal()) return 1;
    long n = 0;
    for (Action a : state.legalActions()) {
      n += perft(state.apply(a), depth - 1);
    }
    return n;
  }
}
