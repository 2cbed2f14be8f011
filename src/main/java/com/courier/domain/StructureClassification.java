package com.courier.domain;

import java.util.Objects;

/**
 * Identifies the format family that matched a message: vendor, product and
 * message class.
 */
public final class StructureClassification {

    private final String vendor;
    private final String product;
    private final String msgclass;

    public StructureClassification(String vendor, String product, String msgclass) {
        this.vendor = Objects.requireNonNull(vendor, "vendor");
        this.product = Objects.requireNonNull(product, "product");
        this.msgclass = Objects.requireNonNull(msgclass, "msgclass");
    }

    public String getVendor() {
        return vendor;
    }

    public String getProduct() {
        return product;
    }

    public String getMsgclass() {
        return msgclass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructureClassification)) return false;
        StructureClassification that = (StructureClassification) o;
        return vendor.equals(that.vendor)
            && product.equals(that.product)
            && msgclass.equals(that.msgclass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vendor, product, msgclass);
    }

    @Override
    public String toString() {
        return vendor + "/" + product + "/" + msgclass;
    }
}
