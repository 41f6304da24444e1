package com.panorama.converter.extract;

import java.util.Optional;

import com.panorama.converter.model.ConfigNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Everything extracted for one device group, plus the standalone document
 * assembled from it.
 */
@Value
@Builder(toBuilder = true)
public class DeviceGroupBundle {

    @NonNull
    String groupName;

    @NonNull
    @ToString.Exclude
    ConfigNode deviceGroup;

    @ToString.Exclude
    ConfigNode shared;

    @ToString.Exclude
    ConfigNode template;

    @ToString.Exclude
    ConfigNode templateStack;

    @NonNull
    @ToString.Exclude
    ConfigNode document;

    public Optional<ConfigNode> shared() {
        return Optional.ofNullable(shared);
    }

    public Optional<ConfigNode> template() {
        return Optional.ofNullable(template);
    }

    public Optional<ConfigNode> templateStack() {
        return Optional.ofNullable(templateStack);
    }

    public String getTemplateName() {
        return template == null ? null : template.getName();
    }

    public String getTemplateStackName() {
        return templateStack == null ? null : templateStack.getName();
    }

    /**
     * @return the synthetic {@code config} root
     */
    public ConfigNode toDocument() {
        return document;
    }
}
