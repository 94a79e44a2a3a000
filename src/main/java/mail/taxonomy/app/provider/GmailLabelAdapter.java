package mail.taxonomy.app.provider;

import com.google.api.services.gmail.model.Label;
import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.schema.FolderSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Gmail labels live in one flat namespace. Hierarchy is expressed through the label
 * name ("BANKING/Invoice"), so the full path is what gets created and matched.
 */
@Slf4j
public class GmailLabelAdapter implements FolderProviderAdapter {
    static final String USER_LABEL_TYPE = "user";
    static final String CATEGORY_PREFIX = "CATEGORY_";
    private static final Set<String> RATE_LIMIT_REASONS = Set.of(
            "rateLimitExceeded", "userRateLimitExceeded", "backendError");

    private final GmailLabelClient client;
    private final ProviderCallExecutor callExecutor;
    private final RetryPolicy retryPolicy;

    public GmailLabelAdapter(GmailLabelClient client, ProviderCallExecutor callExecutor, RetryPolicy retryPolicy) {
        this.client = client;
        this.callExecutor = callExecutor;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public MailProvider provider() {
        return MailProvider.GMAIL;
    }

    @Override
    public ProviderResult<CreatedFolder> create(ProviderCredential credential, FolderRequest request, Duration timeout) {
        return callExecutor.execute("Gmail create label '" + request.getPath() + "'",
                () -> createLabel(credential, request),
                retryPolicy, timeout, GmailLabelAdapter::classify);
    }

    @Override
    public ProviderResult<List<RemoteFolder>> list(ProviderCredential credential, Duration timeout) {
        return callExecutor.execute("Gmail list labels",
                        () -> client.listLabels(credential.getAccessToken()),
                        retryPolicy, timeout, GmailLabelAdapter::classify)
                .map(GmailLabelAdapter::toRemoteFolders);
    }

    @Override
    public ProviderResult<Optional<String>> resolveByName(ProviderCredential credential, FolderRequest request, Duration timeout) {
        return list(credential, timeout).map(folders -> folders.stream()
                .filter(f -> f.getPath().equalsIgnoreCase(request.getPath()))
                .map(RemoteFolder::getId)
                .findFirst());
    }

    @Override
    public RemoteFolder toRemoteFolder(String id, FolderRequest request) {
        String color = request.getColor() != null ? request.getColor().getBackgroundColor() : null;
        return new RemoteFolder(id, request.getPath(), request.getParentRef(), request.getPath(), color);
    }

    private CreatedFolder createLabel(ProviderCredential credential, FolderRequest request) throws IOException {
        try {
            Label created = client.createLabel(credential.getAccessToken(), toLabel(request));
            log.debug("Created Gmail label '{}' with id {}", request.getPath(), created.getId());
            return CreatedFolder.created(created.getId());
        } catch (ProviderApiException e) {
            if (e.getStatus() == 409) {
                return CreatedFolder.alreadyExists(null);
            }
            if (e.getStatus() == 400 && request.getColor() != null && mentionsColor(e)) {
                log.info("Gmail rejected the color of label '{}', creating it without color", request.getPath());
                return createLabel(credential, request.withoutColor());
            }
            throw e;
        }
    }

    static Label toLabel(FolderRequest request) {
        Label label = new Label()
                .setName(request.getPath())
                .setLabelListVisibility("labelShow")
                .setMessageListVisibility("show");
        if (request.getColor() != null) {
            label.setColor(new com.google.api.services.gmail.model.LabelColor()
                    .setBackgroundColor(request.getColor().getBackgroundColor())
                    .setTextColor(request.getColor().getTextColor()));
        }
        return label;
    }

    static List<RemoteFolder> toRemoteFolders(List<Label> labels) {
        List<Label> userLabels = labels.stream()
                .filter(l -> USER_LABEL_TYPE.equals(l.getType()))
                .filter(l -> l.getName() != null && !l.getName().startsWith(CATEGORY_PREFIX))
                .sorted(Comparator.comparingInt((Label l) -> depth(l.getName())).thenComparing(Label::getName))
                .collect(Collectors.toList());

        Map<String, String> idsByName = new HashMap<>();
        for (Label label : userLabels) {
            idsByName.put(label.getName().toLowerCase(Locale.ROOT), label.getId());
        }

        List<RemoteFolder> folders = new ArrayList<>();
        for (Label label : userLabels) {
            String name = label.getName();
            int idx = name.lastIndexOf(FolderSpec.PATH_SEPARATOR);
            String parentRef = idx < 0 ? null : idsByName.get(name.substring(0, idx).toLowerCase(Locale.ROOT));
            String color = label.getColor() != null ? label.getColor().getBackgroundColor() : null;
            folders.add(new RemoteFolder(label.getId(), name, parentRef, name, color));
        }
        return folders;
    }

    static ProviderErrorKind classify(Exception e) {
        if (e instanceof ProviderApiException) {
            ProviderApiException api = (ProviderApiException) e;
            int status = api.getStatus();
            if (status == 401) {
                return ProviderErrorKind.AUTH;
            }
            if (status == 403) {
                return RATE_LIMIT_REASONS.contains(api.getErrorCode()) ? ProviderErrorKind.TRANSIENT : ProviderErrorKind.AUTH;
            }
            if (status == 429 || status >= 500) {
                return ProviderErrorKind.TRANSIENT;
            }
            return ProviderErrorKind.REJECTED;
        }
        if (e instanceof IOException) {
            return ProviderErrorKind.TRANSIENT;
        }
        return ProviderErrorKind.REJECTED;
    }

    private static boolean mentionsColor(ProviderApiException e) {
        return e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains("color");
    }

    private static int depth(String name) {
        int depth = 0;
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }
}
