package com.courier.domain;

import java.util.List;
import java.util.Objects;

/**
 * Record of one plugin that matched a message: the classification it
 * reported and the field names it extracted.
 */
public final class HandlerEntry {

    private final String vendor;
    private final String product;
    private final String msgclass;
    private final List<String> fields;

    public HandlerEntry(String vendor, String product, String msgclass, List<String> fields) {
        this.vendor = vendor;
        this.product = product;
        this.msgclass = msgclass;
        this.fields = List.copyOf(fields);
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

    public List<String> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandlerEntry)) return false;
        HandlerEntry that = (HandlerEntry) o;
        return Objects.equals(vendor, that.vendor)
            && Objects.equals(product, that.product)
            && Objects.equals(msgclass, that.msgclass)
            && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vendor, product, msgclass, fields);
    }

    @Override
    public String toString() {
        return "HandlerEntry{vendor=" + vendor + ", product=" + product
            + ", msgclass=" + msgclass + ", fields=" + fields + "}";
    }
}
