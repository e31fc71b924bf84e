package io.rota4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for materialized occurrences.
 * {@code occurrenceDate} is an ISO local date so the (seriesId, occurrenceDate) unique index compares plain strings.
 */
@Document(collection = "rota_series_instances")
public class SeriesInstanceDocument {

    @Id
    private String id;

    private String seriesId;
    private String occurrenceDate;
    private Instant occurrenceStart;
    private String entityTable;
    private String entityId;
    private boolean exception;
    private String exceptionType;
    private Instant createdAt;
    private Instant reservedAt;

    public SeriesInstanceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public String getOccurrenceDate() {
        return occurrenceDate;
    }

    public void setOccurrenceDate(String occurrenceDate) {
        this.occurrenceDate = occurrenceDate;
    }

    public Instant getOccurrenceStart() {
        return occurrenceStart;
    }

    public void setOccurrenceStart(Instant occurrenceStart) {
        this.occurrenceStart = occurrenceStart;
    }

    public String getEntityTable() {
        return entityTable;
    }

    public void setEntityTable(String entityTable) {
        this.entityTable = entityTable;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public boolean isException() {
        return exception;
    }

    public void setException(boolean exception) {
        this.exception = exception;
    }

    public String getExceptionType() {
        return exceptionType;
    }

    public void setExceptionType(String exceptionType) {
        this.exceptionType = exceptionType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getReservedAt() {
        return reservedAt;
    }

    public void setReservedAt(Instant reservedAt) {
        this.reservedAt = reservedAt;
    }
}
