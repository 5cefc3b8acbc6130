package io.dripline.server.dto;

import java.util.List;

/**
 * JSON form of the server configuration (--config file). Any field left out
 * keeps its default; command-line flags override file values.
 */
public class JsonConfig {
    public Integer httpPort;
    public String dataDir;
    public String owner;
    public String custody;
    public String ledger;
    public Integer ledgerPort;
    public Integer snapshotEvery;
    public Long walRotateBytes;
    public List<String> fund;
}
