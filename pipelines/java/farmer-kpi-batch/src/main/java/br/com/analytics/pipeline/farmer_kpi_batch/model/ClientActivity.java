package br.com.analytics.pipeline.farmer_kpi_batch.model;

/**
 * A business record that belongs to one client and can be attributed to a farmer.
 */
public interface ClientActivity {

    long clientId();
}
