package io.dripline.server.dto;

/** One element of GET /events. */
public class EventEntry {
    public long seq;
    public long period;
    public long index;
    public String account;
    public String amount;
}
