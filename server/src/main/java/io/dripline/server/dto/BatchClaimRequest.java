package io.dripline.server.dto;

import java.util.List;

/** Body of POST /claims/batch. */
public class BatchClaimRequest {
    public String account;
    public List<Entry> entries;

    public static class Entry {
        public Long index;
        public Long period;
        public String balance;
        public List<String> proof;
    }
}
