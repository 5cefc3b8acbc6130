package io.dripline.server.dto;

import java.util.List;

/** Body of POST /claims. Balance is a decimal string, hashes and addresses 0x hex. */
public class ClaimRequest {
    public Long index;
    public String account;
    public Long period;
    public String balance;
    public List<String> proof;
}
