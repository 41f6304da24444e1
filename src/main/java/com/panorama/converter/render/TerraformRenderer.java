package com.panorama.converter.render;

import static com.panorama.converter.render.TerraformNaming.escapeList;
import static com.panorama.converter.render.TerraformNaming.escapeString;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.render.exception.RenderException;
import com.panorama.converter.resolver.Catalog;
import com.panorama.converter.resolver.NamedObject;
import com.panorama.converter.resolver.ObjectTypeRegistry;
import com.panorama.converter.resolver.ResolvedConfiguration;
import com.panorama.converter.router.RouterDescriptor;
import com.panorama.converter.router.RouterKind;
import com.panorama.converter.router.StaticRoute;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders resolved objects and routers as Terraform files for the PAN-OS provider.
 *
 * Only full definitions are rendered; stub entries carry nothing to render.
 * A file is produced only when it has at least one resource, except
 * {@code provider.tf} and {@code variables.tf} which are always produced.
 */
public class TerraformRenderer {

    private static final Logger log = LoggerFactory.getLogger(TerraformRenderer.class);

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final Configuration freemarkerConfig;

    public TerraformRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public List<GeneratedFile> render(ResolvedConfiguration config, List<RouterDescriptor> routers) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(renderFile("provider.tf", Map.of(), 0));
        files.add(renderFile("variables.tf", Map.of(), 0));

        addIfNotEmpty(files, "address_objects.tf", "addresses",
                addressViews(config.catalog(ObjectTypeRegistry.ADDRESS)));
        addIfNotEmpty(files, "address_groups.tf", "groups",
                addressGroupViews(config.catalog(ObjectTypeRegistry.ADDRESS_GROUP)));
        addIfNotEmpty(files, "service_objects.tf", "services",
                serviceViews(config.catalog(ObjectTypeRegistry.SERVICE)));
        addIfNotEmpty(files, "service_groups.tf", "groups",
                serviceGroupViews(config.catalog(ObjectTypeRegistry.SERVICE_GROUP)));
        addIfNotEmpty(files, "tags.tf", "tags",
                tagViews(config.catalog(ObjectTypeRegistry.TAG)));

        if (!routers.isEmpty()) {
            files.add(renderRouters(routers));
        }

        log.info("Rendered {} Terraform files", files.size());
        return files;
    }

    GeneratedFile renderRouters(List<RouterDescriptor> routers) {
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        TerraformNaming.UniqueNames routeNames = new TerraformNaming.UniqueNames();
        List<Map<String, Object>> views = new ArrayList<>();
        int resources = 0;
        long logical = 0;

        for (RouterDescriptor router : routers) {
            String resource = names.next(router.getName());
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("resource", resource);
            view.put("name", escapeString(router.getName()));
            view.put("template", router.getTemplate());
            view.put("logical", router.getKind() == RouterKind.LOGICAL);
            putList(view, "interfaces", router.getInterfaces());

            List<Map<String, Object>> routes = new ArrayList<>();
            for (StaticRoute route : router.getStaticRoutes()) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("resource", routeNames.next(resource + "_" + route.getName()));
                r.put("name", escapeString(route.getName()));
                putString(r, "destination", route.getDestination());
                putString(r, "nexthopIp", route.getNexthopIp());
                putString(r, "nexthopRouter", route.getNexthopRouter());
                putMetric(r, route);
                routes.add(r);
            }
            view.put("routes", routes);
            views.add(view);

            resources += 1 + routes.size();
            if (router.getKind() == RouterKind.LOGICAL) {
                logical++;
            }
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("routers", views);
        model.put("virtualCount", routers.size() - logical);
        model.put("logicalCount", logical);
        return renderFile("virtual_routers.tf", model, resources);
    }

    private void addIfNotEmpty(List<GeneratedFile> files, String fileName, String key, List<Map<String, Object>> views) {
        if (views.isEmpty()) {
            return;
        }
        files.add(renderFile(fileName, Map.of(key, views), views.size()));
    }

    private GeneratedFile renderFile(String fileName, Map<String, Object> model, int resourceCount) {
        String templateName = fileName + ".ftl";
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            log.debug("Rendered {} ({} resources)", fileName, resourceCount);
            return GeneratedFile.builder()
                    .fileName(fileName)
                    .contents(out.toString())
                    .resourceCount(resourceCount)
                    .build();
        } catch (IOException | TemplateException e) {
            throw new RenderException(templateName, e.getMessage(), e);
        }
    }

    // ---- views ----

    private static List<Map<String, Object>> addressViews(Catalog catalog) {
        List<Map<String, Object>> views = new ArrayList<>();
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        for (NamedObject addr : fullObjects(catalog)) {
            Map<String, Object> view = baseView(addr, names);
            String type = addr.getString("type");
            if ("ip-range".equals(type) || "fqdn".equals(type)) {
                view.put("type", escapeString(type));
            }
            String value = addr.getString("value");
            view.put("value", escapeString(value != null ? value : ""));
            putList(view, "tags", addr.getList("tags"));
            views.add(view);
        }
        return views;
    }

    private static List<Map<String, Object>> addressGroupViews(Catalog catalog) {
        List<Map<String, Object>> views = new ArrayList<>();
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        for (NamedObject group : fullObjects(catalog)) {
            Map<String, Object> view = baseView(group, names);
            putList(view, "staticMembers", group.getList("static_members"));
            putString(view, "dynamicFilter", group.getString("dynamic_filter"));
            views.add(view);
        }
        return views;
    }

    private static List<Map<String, Object>> serviceViews(Catalog catalog) {
        List<Map<String, Object>> views = new ArrayList<>();
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        for (NamedObject svc : fullObjects(catalog)) {
            Map<String, Object> view = baseView(svc, names);
            String protocol = svc.getString("protocol");
            view.put("protocol", escapeString(protocol != null ? protocol : "tcp"));
            putString(view, "port", svc.getString("port"));
            putString(view, "sourcePort", svc.getString("source_port"));
            views.add(view);
        }
        return views;
    }

    private static List<Map<String, Object>> serviceGroupViews(Catalog catalog) {
        List<Map<String, Object>> views = new ArrayList<>();
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        for (NamedObject group : fullObjects(catalog)) {
            Map<String, Object> view = baseView(group, names);
            putList(view, "members", group.getList("members"));
            views.add(view);
        }
        return views;
    }

    private static List<Map<String, Object>> tagViews(Catalog catalog) {
        List<Map<String, Object>> views = new ArrayList<>();
        TerraformNaming.UniqueNames names = new TerraformNaming.UniqueNames();
        for (NamedObject tag : catalog.fullObjects()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("resource", names.next(tag.getName()));
            view.put("name", escapeString(tag.getName()));
            putString(view, "color", tag.getString("color"));
            putString(view, "comment", tag.getString("comments"));
            views.add(view);
        }
        return views;
    }

    private static List<NamedObject> fullObjects(Catalog catalog) {
        long stubs = catalog.stubCount();
        if (stubs > 0) {
            log.info("Skipping {} reference-only {} entries", stubs, catalog.getType());
        }
        return catalog.fullObjects();
    }

    private static Map<String, Object> baseView(NamedObject object, TerraformNaming.UniqueNames names) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("resource", names.next(object.getName()));
        view.put("name", escapeString(object.getName()));
        putString(view, "description", object.getString("description"));
        return view;
    }

    private static void putMetric(Map<String, Object> view, StaticRoute route) {
        String metric = route.getMetric();
        if (metric == null || metric.isEmpty()) {
            return;
        }
        if (NUMBER.matcher(metric).matches()) {
            view.put("metric", metric);
        } else {
            log.warn("Static route {} has a non-numeric metric '{}', rendering it quoted", route.getName(), metric);
            view.put("metric", escapeString(metric));
        }
    }

    private static void putString(Map<String, Object> view, String key, String value) {
        if (value != null && !value.isEmpty()) {
            view.put(key, escapeString(value));
        }
    }

    private static void putList(Map<String, Object> view, String key, List<String> values) {
        if (!values.isEmpty()) {
            view.put(key, escapeList(values));
        }
    }
}
