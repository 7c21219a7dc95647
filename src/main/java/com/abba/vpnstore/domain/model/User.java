package com.abba.vpnstore.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

@Document(collection = "users")
@Data
public class User {

    @Id
    private Long id;
    private String username;
    private String displayName;
    private Language language = Language.EN;
    @Indexed
    private Long referrerId;
    private boolean trialUsed;
    private Instant subscriptionEnd;
    private BigDecimal totalPaid = BigDecimal.ZERO;
    private Instant createdAt;
    private boolean blocked;

    public boolean hasReferrer() {
        return referrerId != null;
    }

    /**
     * Flips the trial flag. The flag never goes back to false.
     */
    public void markTrialUsed() {
        this.trialUsed = true;
    }

    public void addPaid(BigDecimal amount) {
        this.totalPaid = (totalPaid == null ? BigDecimal.ZERO : totalPaid).add(amount);
    }

    public User copy() {
        User copy = new User();
        copy.setId(id);
        copy.setUsername(username);
        copy.setDisplayName(displayName);
        copy.setLanguage(language);
        copy.setReferrerId(referrerId);
        copy.setTrialUsed(trialUsed);
        copy.setSubscriptionEnd(subscriptionEnd);
        copy.setTotalPaid(totalPaid);
        copy.setCreatedAt(createdAt);
        copy.setBlocked(blocked);
        return copy;
    }
}
