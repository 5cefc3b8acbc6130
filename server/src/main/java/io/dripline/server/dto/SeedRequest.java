package io.dripline.server.dto;

/** Body of PUT /admin/roots/{period}. */
public class SeedRequest {
    public String root;
    public String totalAllocation;
    public String fundingSource;
}
