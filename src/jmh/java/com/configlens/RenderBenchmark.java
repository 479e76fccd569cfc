package com.configlens;

import com.configlens.config.RenderConfig;
import com.configlens.document.Node;
import com.configlens.path.LineAddress;
import com.configlens.path.PathReconstructor;
import com.configlens.provenance.InMemoryProvenanceStore;
import com.configlens.provenance.ProvenanceEntry;
import com.configlens.provenance.ProvenanceKind;
import com.configlens.render.ProvenanceRenderers;
import com.configlens.yaml.SnakeYamlSerializer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 路径重建与内联渲染性能基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RenderBenchmark {

    @State(Scope.Thread)
    public static class DocumentState {
        Node document;
        String yaml;
        InMemoryProvenanceStore store;
        PathReconstructor reconstructor;
        ProvenanceRenderers renderers;

        @Setup
        public void setup() throws IOException {
            Map<String, Object> components = new LinkedHashMap<>();
            store = new InMemoryProvenanceStore();
            // 500 个组件，每个带映射、数组和对象数组
            for (int i = 0; i < 500; i++) {
                Map<String, Object> vars = new LinkedHashMap<>();
                vars.put("name", "component-" + i);
                vars.put("enabled", i % 2 == 0);
                List<String> tags = new ArrayList<>();
                for (int t = 0; t < 5; t++) {
                    tags.add("tag-" + t);
                    store.recordProvenance("components.terraform.c" + i + ".vars.tags[" + t + "]",
                            new ProvenanceEntry("stacks/catalog/c" + i + ".yaml", t + 3, ProvenanceKind.IMPORT, t % 5));
                }
                vars.put("tags", tags);
                vars.put("subnets", List.of(Map.of("name", "public", "size", 24), Map.of("name", "private", "size", 20)));
                components.put("c" + i, Map.of("vars", vars));
                store.recordProvenance("components.terraform.c" + i + ".vars.name",
                        new ProvenanceEntry("stacks/dev.yaml", i + 1, ProvenanceKind.INLINE, 0));
            }
            store.recordProvenance("components", new ProvenanceEntry("stacks/dev.yaml", 1, ProvenanceKind.INLINE, 0));

            document = Node.of(Map.of("components", Map.of("terraform", components)));
            yaml = new SnakeYamlSerializer().serialize(document, 2);
            reconstructor = new PathReconstructor();
            renderers = new ProvenanceRenderers(RenderConfig.plain());
        }
    }

    @Benchmark
    public Map<Integer, LineAddress> reconstructPaths(DocumentState state) {
        return state.reconstructor.reconstruct(state.yaml);
    }

    @Benchmark
    public String renderInline(DocumentState state) {
        return state.renderers.renderInline(state.document, state.store, "dev.yaml");
    }

    @Benchmark
    public String renderTree(DocumentState state) {
        return state.renderers.renderTree(state.store, null);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(RenderBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
