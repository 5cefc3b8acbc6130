package io.dripline.server.dto;

/** Body of POST /admin/owner. With twoStep the new owner must accept before it takes effect. */
public class OwnerRequest {
    public String newOwner;
    public boolean twoStep;
}
