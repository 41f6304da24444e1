package com.panorama.converter.extract;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of extracting one device group: a bundle, or not found.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionResult {

    public enum Status {
        FOUND,
        NOT_FOUND
    }

    String groupName;
    Status status;
    DeviceGroupBundle bundle;

    public static ExtractionResult found(DeviceGroupBundle bundle) {
        return new ExtractionResult(bundle.getGroupName(), Status.FOUND, bundle);
    }

    public static ExtractionResult notFound(String groupName) {
        return new ExtractionResult(groupName, Status.NOT_FOUND, null);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public Optional<DeviceGroupBundle> bundle() {
        return Optional.ofNullable(bundle);
    }
}
