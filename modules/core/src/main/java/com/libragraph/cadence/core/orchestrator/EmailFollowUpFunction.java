package com.libragraph.cadence.core.orchestrator;

import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.oauth.OAuthService;
import com.libragraph.cadence.core.scheduler.JobContext;
import com.libragraph.cadence.core.scheduler.WorkFunction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

/** Sends the deferred reply for an email set aside by {@link EmailTriagePipeline}. */
@ApplicationScoped
public class EmailFollowUpFunction implements WorkFunction {

    public static final String WORK_REF = "email_followup";

    private final OAuthService oauth;
    private final ReplyGenerator replyGenerator;
    private final ReplySender replySender;

    @Inject
    public EmailFollowUpFunction(OAuthService oauth, ReplyGenerator replyGenerator, ReplySender replySender) {
        this.oauth = oauth;
        this.replyGenerator = replyGenerator;
        this.replySender = replySender;
    }

    @Override
    public String workRef() {
        return WORK_REF;
    }

    @Override
    public String run(JobContext context) throws Exception {
        ScoredEmail email = ScoredEmail.fromArgs(context.args());
        Optional<DraftReply> draft = replyGenerator.draft(context.tenantId(), email);
        if (draft.isEmpty()) {
            return "No reply generated for scheduled email " + email.id();
        }
        String accessToken = oauth.getValidToken(context.tenantId(), Provider.GOOGLE).accessToken();
        replySender.send(context.tenantId(), accessToken, draft.get());
        return "Sent scheduled reply for email " + email.id();
    }
}
