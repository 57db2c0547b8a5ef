package com.assetmetrics.history.domain;

/**
 * A single machine in an AWS fleet whose metrics are read from the upstream.
 *
 * @param region AWS region, e.g. "us-east-1"
 * @param accountNumber Owner account number, e.g. "12345678901"
 * @param instanceId EC2 instance id, e.g. "i-12345678"
 */
public record Asset(
    String region,
    String accountNumber,
    String instanceId
) {

    /**
     * Returns the upstream asset id. File-system metrics live under a separate asset.
     * e.g. "arn:aws:ec2:us-east-1:12345678901:instance/i-12345678"
     */
    public String toAssetId(boolean fileSystem) {
        String instanceArn = String.format(
            "arn:aws:ec2:%s:%s:instance/%s", region, accountNumber, instanceId);
        return fileSystem ? instanceArn + ":fs//" : instanceArn;
    }

    public boolean isComplete() {
        return notBlank(region) && notBlank(accountNumber) && notBlank(instanceId);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
