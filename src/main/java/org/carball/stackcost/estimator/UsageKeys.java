package org.carball.stackcost.estimator;

/**
 * Usage assumption keys. Callers use the same names in usage override files.
 */
public final class UsageKeys {

    // Shared
    public static final String AVG_MONTHLY_REQUESTS = "avg_monthly_requests";
    public static final String AVG_RESOURCE_COUNT = "avg_resource_count";
    public static final String DATA_TRANSFER_GB = "data_transfer_gb";
    public static final String STORAGE_GB = "storage_gb";
    public static final String USAGE_HOURS = "usage_hours";
    public static final String APPLY_FREE_TIER = "apply_free_tier";

    // Lambda
    public static final String FUNCTION_COUNT = "function_count";
    public static final String AVG_MEMORY_SIZE = "avg_memory_size";
    public static final String AVG_DURATION_MS = "avg_duration_ms";

    // S3
    public static final String BUCKET_COUNT = "bucket_count";
    public static final String STORAGE_GB_PER_BUCKET = "storage_gb_per_bucket";
    public static final String MONTHLY_GET_REQUESTS = "monthly_get_requests";
    public static final String MONTHLY_PUT_REQUESTS = "monthly_put_requests";

    // DynamoDB
    public static final String TABLE_COUNT = "table_count";
    public static final String STORAGE_GB_PER_TABLE = "storage_gb_per_table";
    public static final String PROVISIONED_MODE = "provisioned_mode";
    public static final String READ_CAPACITY_UNITS = "read_capacity_units";
    public static final String WRITE_CAPACITY_UNITS = "write_capacity_units";
    public static final String MONTHLY_READ_REQUEST_UNITS = "monthly_read_request_units";
    public static final String MONTHLY_WRITE_REQUEST_UNITS = "monthly_write_request_units";

    // API Gateway
    public static final String API_COUNT = "api_count";
    public static final String MONTHLY_REQUESTS = "monthly_requests";

    // EC2
    public static final String INSTANCE_COUNT = "instance_count";
    public static final String INSTANCE_TYPE = "instance_type";
    public static final String EBS_STORAGE_GB = "ebs_storage_gb";
    public static final String EBS_STORAGE_GB_PER_INSTANCE = "ebs_storage_gb_per_instance";
    public static final String AVG_CPU_UTILIZATION = "avg_cpu_utilization";

    private UsageKeys() {
    }
}
