package com.landrecords.ec.service;

import com.landrecords.ec.captcha.CaptchaResolver;
import com.landrecords.ec.model.SearchTarget;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything one batch run needs besides the injected collaborators. Built per request,
 * never shared between runs.
 */
@Getter
@Builder
public class RunContext {

    private final String runId;
    private final List<SearchTarget> targets;
    private final String partyName;
    private final String middleName;
    private final String lastName;
    private final LocalDate fromDate;
    private final LocalDate toDate;
    private final boolean captchaReuse;
    private final Duration interTargetDelay;
    private final CaptchaResolver resolver;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicInteger targetsDone = new AtomicInteger();

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public String fullPartyName() {
        StringBuilder name = new StringBuilder(partyName);
        if (middleName != null && !middleName.isBlank()) name.append(' ').append(middleName.trim());
        if (lastName != null && !lastName.isBlank()) name.append(' ').append(lastName.trim());
        return name.toString();
    }
}
