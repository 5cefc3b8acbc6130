package io.dripline.server.dto;

import java.util.List;

public class BatchClaimResponse {
    public boolean ok;
    public List<ClaimResponse> claimed;
    public String total;
}
