package io.dripline.server.dto;

public class ClaimResponse {
    public boolean ok;
    public long period;
    public long index;
    public String account;
    public String amount;
}
