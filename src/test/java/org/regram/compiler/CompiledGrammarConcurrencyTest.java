package org.regram.compiler;

import org.regram.compiler.api.AdaptOptions;
import org.regram.compiler.api.CompiledGrammar;
import org.regram.compiler.api.CompiledPattern;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.UnsupportedConstructException;
import org.regram.compiler.backend.dialect.DialectAdapter;
import org.regram.compiler.backend.validate.Validator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests that concurrent pattern requests for the same key adapt the macro only once.
 */
@ExtendWith(MockitoExtension.class)
public class CompiledGrammarConcurrencyTest {

    private static final DialectProfile JAVA = DialectProfile.builder().namedCaptureSupport(true).build();
    private static final int THREADS = 8;

    @Spy
    private DialectAdapter adapter = new DialectAdapter();

    @Test
    @Tag("integration")
    void concurrentFirstRequestsShareOneAdaptation() throws Exception {
        CompiledGrammar grammar = new DefaultGrammarCompiler(CompilerLimits.defaults(), adapter, new Validator())
                .compile("$(!w)=(?<w>\\w+)\n$(pair)=$(w)=(\\d+)");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<CompiledPattern>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                Callable<CompiledPattern> request = () -> {
                    start.await();
                    return grammar.pattern("pair", JAVA);
                };
                futures.add(executor.submit(request));
            }
            start.countDown();

            CompiledPattern first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<CompiledPattern> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            executor.shutdownNow();
        }

        verify(adapter, times(1)).adapt(eq("pair"), any(), eq(JAVA), eq(AdaptOptions.DEFAULTS));
    }

    @Test
    @Tag("unit")
    void failuresAreCachedPerKey() throws Exception {
        CompiledGrammar grammar = new DefaultGrammarCompiler(CompilerLimits.defaults(), adapter, new Validator())
                .compile("$(lb)=(?<=a*)b");

        assertThatThrownBy(() -> grammar.pattern("lb", JAVA)).isInstanceOf(UnsupportedConstructException.class);
        assertThatThrownBy(() -> grammar.pattern("lb", JAVA)).isInstanceOf(UnsupportedConstructException.class);

        verify(adapter, times(1)).adapt(eq("lb"), any(), eq(JAVA), any());
    }

    @Test
    @Tag("unit")
    void distinctOptionsAreDistinctKeys() throws Exception {
        CompiledGrammar grammar = new DefaultGrammarCompiler(CompilerLimits.defaults(), adapter, new Validator())
                .compile("$(a)=(?<x>a)");

        grammar.pattern("a", JAVA);
        grammar.pattern("a", JAVA, new AdaptOptions(true, false));
        grammar.pattern("a", JAVA);

        verify(adapter, times(2)).adapt(eq("a"), any(), eq(JAVA), any());
    }
}
