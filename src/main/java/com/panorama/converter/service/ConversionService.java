package com.panorama.converter.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.model.diagnostics.ToolDiagnostics;
import com.panorama.converter.parser.ConfigTreeLoader;
import com.panorama.converter.render.GeneratedFile;
import com.panorama.converter.render.TerraformRenderer;
import com.panorama.converter.resolver.Catalog;
import com.panorama.converter.resolver.ObjectType;
import com.panorama.converter.resolver.ObjectTypeRegistry;
import com.panorama.converter.resolver.ResolvedConfiguration;
import com.panorama.converter.resolver.ScopeResolver;
import com.panorama.converter.router.RouterAggregator;
import com.panorama.converter.router.RouterDescriptor;
import com.panorama.converter.router.RouterKind;
import com.panorama.converter.writer.FileWriteUtil;

/**
 * Load, resolve, aggregate routers, render and write Terraform files.
 */
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final ConfigTreeLoader loader;
    private final ObjectTypeRegistry registry;
    private final ScopeResolver resolver;
    private final RouterAggregator routerAggregator;
    private final TerraformRenderer renderer;

    public ConversionService() {
        this.loader = new ConfigTreeLoader();
        this.registry = ObjectTypeRegistry.defaultRegistry();
        this.resolver = new ScopeResolver(registry);
        this.routerAggregator = new RouterAggregator();
        this.renderer = new TerraformRenderer();
    }

    /**
     * @throws com.panorama.converter.parser.exception.ParseException if the input is not a readable XML document
     * @throws com.panorama.converter.render.exception.RenderException if a template fails
     * @throws IOException if an output file cannot be written
     */
    public ConversionResult convert(ConverterConfig config) throws IOException {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        log.info("Step 1: Loading configuration...");
        ConfigNode root = loader.load(config.getInputFile());

        log.info("Step 2: Resolving objects...");
        ResolvedConfiguration resolved = resolver.resolveAll(root);

        log.info("Step 3: Aggregating routers...");
        List<RouterDescriptor> routers = routerAggregator.resolveRouters(root);

        log.info("Step 4: Rendering Terraform...");
        List<GeneratedFile> files = renderer.render(resolved, routers);

        log.info("Step 5: Writing files...");
        Path outputDir = config.getOutputDir();
        FileWriteUtil.createDirectories(outputDir);
        for (GeneratedFile file : files) {
            FileWriteUtil.safeWriteString(outputDir.resolve(file.getFileName()), file.getContents());
            log.debug("Wrote {}", file.getFileName());
        }

        long stubs = 0;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ObjectType type : registry.getTypes()) {
            Catalog catalog = resolved.catalog(type.getKey());
            counts.put(type.getLabel(), catalog.size());
            stubs += catalog.stubCount();
        }
        if (stubs > 0) {
            diagnostics.info(stubs + " objects are only referenced, never defined, in this export");
        }
        if (routers.isEmpty()) {
            diagnostics.warn("No virtual or logical routers found");
        }

        long logical = routers.stream().filter(r -> r.getKind() == RouterKind.LOGICAL).count();
        return ConversionResult.builder()
                .outputDir(outputDir)
                .objectCounts(counts)
                .totalObjects(resolved.totalObjects())
                .referenceOnlyObjects(stubs)
                .virtualRouters((int) (routers.size() - logical))
                .logicalRouters((int) logical)
                .files(files)
                .diagnostics(diagnostics)
                .build();
    }
}
