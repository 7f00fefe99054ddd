package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.risk.KillSwitchState;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Единственная строка (id = 1). Не пересчитывается из волатильного состояния,
 * снимается только ручным reset.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "kill_switch_state")
public class KillSwitchStateEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private KillSwitchState state;

    @Column(name = "tripped_at")
    private Instant trippedAt;

    @Column(name = "drawdown_at_trip")
    private Double drawdownAtTrip;

    @Column(name = "peak_equity_at_trip")
    private Double peakEquityAtTrip;

    @Column(name = "equity_at_trip")
    private Double equityAtTrip;

    @Column(name = "reset_at")
    private Instant resetAt;

    @Column(name = "reset_by", length = 64)
    private String resetBy;

    @Column(name = "reset_note", length = 512)
    private String resetNote;

    @Column(name = "reset_equity")
    private Double resetEquity;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public void apply(KillSwitchStatus s) {
        this.id = SINGLETON_ID;
        this.state = s.state();
        this.trippedAt = s.trippedAt();
        this.drawdownAtTrip = s.drawdownAtTrip();
        this.peakEquityAtTrip = s.peakEquityAtTrip();
        this.equityAtTrip = s.equityAtTrip();
        this.resetAt = s.resetAt();
        this.resetBy = s.resetBy();
        this.resetNote = s.resetNote();
        this.resetEquity = s.resetEquity();
        this.updatedAt = s.updatedAt() != null ? s.updatedAt() : Instant.now();
    }

    public KillSwitchStatus toDomain() {
        return KillSwitchStatus.builder()
                .state(state)
                .trippedAt(trippedAt)
                .drawdownAtTrip(drawdownAtTrip)
                .peakEquityAtTrip(peakEquityAtTrip)
                .equityAtTrip(equityAtTrip)
                .resetAt(resetAt)
                .resetBy(resetBy)
                .resetNote(resetNote)
                .resetEquity(resetEquity)
                .updatedAt(updatedAt)
                .build();
    }
}
