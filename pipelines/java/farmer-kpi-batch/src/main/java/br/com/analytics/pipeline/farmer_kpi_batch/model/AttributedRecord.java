package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

public record AttributedRecord<T extends ClientActivity>(
        T record,
        @Nullable Long responsibleFarmerId,
        @Nullable String responsibleFarmerName
) {

    public boolean isResolved() {
        return responsibleFarmerId != null;
    }
}
