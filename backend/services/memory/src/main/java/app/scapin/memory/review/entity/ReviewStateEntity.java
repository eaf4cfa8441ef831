package app.scapin.memory.review.entity;

import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@IdClass(ReviewStateKey.class)
@Table(name = "review_states", schema = "app_memory")
public class ReviewStateEntity {

    @Id
    @Column(name = "note_id", nullable = false)
    private String noteId;

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "cycle", nullable = false)
    private CycleKind cycle;

    @Enumerated(EnumType.STRING)
    @Column(name = "note_type", nullable = false)
    private NoteType noteType;

    @Enumerated(EnumType.STRING)
    @Column(name = "importance", nullable = false)
    private ImportanceLevel importance;

    @Column(name = "importance_rank", nullable = false)
    private int importanceRank;

    @Column(name = "easiness_factor", nullable = false)
    private double easinessFactor;

    @Column(name = "repetition", nullable = false)
    private int repetition;

    @Column(name = "interval_hours", nullable = false)
    private double intervalHours;

    @Column(name = "next_due_at")
    private Instant nextDueAt;

    @Column(name = "last_completed_at")
    private Instant lastCompletedAt;

    @Column(name = "completion_count", nullable = false)
    private int completionCount;

    @Column(name = "last_quality")
    private Integer lastQuality;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    public String getNoteId() {
        return noteId;
    }

    public void setNoteId(String noteId) {
        this.noteId = noteId;
    }

    public CycleKind getCycle() {
        return cycle;
    }

    public void setCycle(CycleKind cycle) {
        this.cycle = cycle;
    }

    public NoteType getNoteType() {
        return noteType;
    }

    public void setNoteType(NoteType noteType) {
        this.noteType = noteType;
    }

    public ImportanceLevel getImportance() {
        return importance;
    }

    public void setImportance(ImportanceLevel importance) {
        this.importance = importance;
        this.importanceRank = importance == null ? ImportanceLevel.NORMAL.rank() : importance.rank();
    }

    public int getImportanceRank() {
        return importanceRank;
    }

    public double getEasinessFactor() {
        return easinessFactor;
    }

    public void setEasinessFactor(double easinessFactor) {
        this.easinessFactor = easinessFactor;
    }

    public int getRepetition() {
        return repetition;
    }

    public void setRepetition(int repetition) {
        this.repetition = repetition;
    }

    public double getIntervalHours() {
        return intervalHours;
    }

    public void setIntervalHours(double intervalHours) {
        this.intervalHours = intervalHours;
    }

    public Instant getNextDueAt() {
        return nextDueAt;
    }

    public void setNextDueAt(Instant nextDueAt) {
        this.nextDueAt = nextDueAt;
    }

    public Instant getLastCompletedAt() {
        return lastCompletedAt;
    }

    public void setLastCompletedAt(Instant lastCompletedAt) {
        this.lastCompletedAt = lastCompletedAt;
    }

    public int getCompletionCount() {
        return completionCount;
    }

    public void setCompletionCount(int completionCount) {
        this.completionCount = completionCount;
    }

    public Integer getLastQuality() {
        return lastQuality;
    }

    public void setLastQuality(Integer lastQuality) {
        this.lastQuality = lastQuality;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getRowVersion() {
        return rowVersion;
    }
}
