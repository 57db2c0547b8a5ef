package com.assetmetrics.history.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Asset Tests")
class AssetTest {

    private final Asset asset = new Asset("us-east-1", "12345", "i-12345678");

    @Test
    @DisplayName("Should build the instance asset id")
    void testInstanceAssetId() {
        assertThat(asset.toAssetId(false)).isEqualTo("arn:aws:ec2:us-east-1:12345:instance/i-12345678");
    }

    @Test
    @DisplayName("Should build the file system asset id")
    void testFileSystemAssetId() {
        assertThat(asset.toAssetId(true)).isEqualTo("arn:aws:ec2:us-east-1:12345:instance/i-12345678:fs//");
    }

    @Test
    @DisplayName("Should require all three identifiers")
    void testIsComplete() {
        assertThat(asset.isComplete()).isTrue();
        assertThat(new Asset("us-east-1", null, "i-12345678").isComplete()).isFalse();
        assertThat(new Asset("us-east-1", "12345", " ").isComplete()).isFalse();
    }
}
