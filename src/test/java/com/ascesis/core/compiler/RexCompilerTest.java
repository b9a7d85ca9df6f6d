package com.ascesis.core.compiler;

import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.ContextHandle;
import com.ascesis.core.rex.Rex;
import com.ascesis.infrastructure.telemetry.TracingService;
import com.ascesis.model.ArrowLink;
import com.ascesis.model.ArrowOperator;
import com.ascesis.model.FatArrowRule;
import com.ascesis.model.Polynomial;
import com.ascesis.model.ThinArrowRule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RexCompilerTest {

    private static final Logger compilerLogger = Logger.getLogger(RexCompiler.class.getName());

    private RexCompiler compiler;
    private ContextHandle ctx;
    private final List<LogRecord> warnings = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            if (record.getLevel() == Level.WARNING) {
                warnings.add(record);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        compiler = new RexCompiler(TracingService.noopTracer());
        ctx = ContextHandle.create("test");
        compilerLogger.addHandler(capture);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.removeHandler(capture);
    }

    // --- Helper Methods ---

    private int id(String name) {
        return ctx.withContext(context -> context.intern(name));
    }

    private IntList set(String... names) {
        IntList ids = new IntArrayList();
        for (String name : names) {
            ids.add(id(name));
        }
        return CausalContent.nodeSet(ids);
    }

    private static Polynomial p(String name) {
        return Polynomial.of(name);
    }

    private static ArrowLink link(ArrowOperator operator, Polynomial polynomial) {
        return ArrowLink.of(operator, polynomial);
    }

    private static Rex thin(Polynomial head, ArrowLink... tail) {
        return Rex.of(ThinArrowRule.fromParts(head, List.of(tail)));
    }

    private static Rex fat(Polynomial head, ArrowLink... tail) {
        return Rex.of(FatArrowRule.fromParts(head, List.of(tail)));
    }

    // --- Test Cases ---

    @Test
    @DisplayName("a => b compiles into an effect of a and a cause of b")
    void testSingleFatArrow() {
        CausalContent content = compiler.compileNormalized(fat(p("a"), link(ArrowOperator.FAT_TX, p("b"))), ctx);

        assertThat(content.getEffects(id("a"))).containsExactly(set("b"));
        assertThat(content.getCauses(id("b"))).containsExactly(set("a"));
        assertThat(content.getCauses(id("a"))).isEmpty();
        assertThat(content.getEffects(id("b"))).isEmpty();
    }

    @Test
    @DisplayName("a <= b => c compiles the fork into alternative effects of b")
    void testFork() {
        CausalContent content = compiler.compileNormalized(
                fat(p("a"), link(ArrowOperator.FAT_RX, p("b")), link(ArrowOperator.FAT_TX, p("c"))), ctx);

        assertThat(content.getEffects(id("b"))).containsExactly(set("a"), set("c"));
        assertThat(content.getCauses(id("a"))).containsExactly(set("b"));
        assertThat(content.getCauses(id("c"))).containsExactly(set("b"));
    }

    @Test
    @DisplayName("Sum of thin rules unions their families")
    void testSum() {
        Rex rex = thin(p("a"), link(ArrowOperator.THIN_TX, p("b")))
                .withMore(List.of(Rex.Link.sum(thin(p("a"), link(ArrowOperator.THIN_TX, p("c"))))));

        CausalContent content = compiler.compile(rex, ctx);

        assertThat(content.getEffects(id("a"))).containsExactly(set("b"), set("c"));
    }

    @Test
    @DisplayName("Product of thin rules multiplies the families of shared identifiers")
    void testProduct() {
        Rex rex = thin(p("a"), link(ArrowOperator.THIN_TX, p("b")))
                .withMore(List.of(
                        Rex.Link.product(thin(p("a"), link(ArrowOperator.THIN_TX, p("c")))),
                        Rex.Link.product(thin(p("d"), link(ArrowOperator.THIN_RX, p("a"))))));

        CausalContent content = compiler.compile(rex, ctx);

        assertThat(content.getEffects(id("a"))).containsExactly(set("b", "c"));
        assertThat(content.getCauses(id("d"))).containsExactly(set("a"));
    }

    @Test
    @DisplayName("Instances resolve to previously compiled content")
    void testInstance() {
        CausalContent defined = compiler.compile(thin(p("x"), link(ArrowOperator.THIN_TX, p("y"))), ctx);
        ctx.useContext(context -> context.addContent("Arrow", defined));

        Rex rex = Rex.instance("Arrow", List.of())
                .withMore(List.of(Rex.Link.sum(Rex.immediate("Arrow", List.of()))));
        CausalContent content = compiler.compile(rex, ctx);

        assertThat(content).isEqualTo(defined);
    }

    @Test
    @DisplayName("A reference to an uncompiled structure is a retryable dependency error")
    void testUnresolvedDependency() {
        assertThatThrownBy(() -> compiler.compile(Rex.instance("Missing", List.of()), ctx))
                .isInstanceOf(UnresolvedDependencyException.class)
                .satisfies(e -> {
                    UnresolvedDependencyException error = (UnresolvedDependencyException) e;
                    assertThat(error.getDependencyName()).isEqualTo("Missing");
                    assertThat(error.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("A retried fold after an unresolved reference reuses the identifiers interned before it")
    void testRetryAfterUnresolvedDependency() {
        Rex rex = Rex.instance("Later", List.of())
                .withMore(List.of(Rex.Link.sum(thin(p("x"), link(ArrowOperator.THIN_TX, p("y"))))));

        assertThatThrownBy(() -> compiler.compile(rex, ctx)).isInstanceOf(UnresolvedDependencyException.class);
        int x = id("x");
        int y = id("y");

        CausalContent later = compiler.compile(thin(p("z"), link(ArrowOperator.THIN_TX, p("x"))), ctx);
        ctx.useContext(context -> context.addContent("Later", later));
        CausalContent content = compiler.compile(rex, ctx);

        assertThat(id("x")).isEqualTo(x);
        assertThat(id("y")).isEqualTo(y);
        assertThat(content.getEffects(x)).containsExactly(set("y"));
        assertThat(content.getEffects(id("z"))).containsExactly(set("x"));
    }

    @Test
    @DisplayName("A fat arrow rule reaching the fold is an invariant violation")
    void testFatLeak() {
        Rex rex = fat(p("a"), link(ArrowOperator.FAT_TX, p("b")));

        assertThatThrownBy(() -> compiler.compile(rex, ctx))
                .isInstanceOf(CompilationException.class)
                .satisfies(e -> {
                    CompilationException error = (CompilationException) e;
                    assertThat(error.getReason()).isEqualTo(CompilationException.Reason.FAT_LEAK);
                    assertThat(error.isInvariantViolation()).isTrue();
                });
    }

    @Test
    @DisplayName("Idempotency warnings are logged without failing compilation")
    void testWarningsAreLogged() {
        Polynomial bb = p("b");
        bb.addAssign(p("b"));

        CausalContent content = compiler.compile(thin(p("a"), link(ArrowOperator.THIN_TX, bb)), ctx);

        assertThat(content.getEffects(id("a"))).containsExactly(set("b"));
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getMessage()).contains("Idempotent sum of 'b'");
    }

    @Test
    @DisplayName("Warning logging can be switched off")
    void testWarningsCanBeSilenced() {
        RexCompiler quiet = new RexCompiler(TracingService.noopTracer(),
                CompilerConfig.builder().logPolynomialWarnings(false).build());
        Polynomial bb = p("b");
        bb.addAssign(p("b"));

        quiet.compile(thin(p("a"), link(ArrowOperator.THIN_TX, bb)), ctx);

        assertThat(warnings).isEmpty();
    }
}
