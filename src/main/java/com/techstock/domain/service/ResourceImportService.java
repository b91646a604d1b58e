package com.techstock.domain.service;

import com.techstock.domain.model.ImportReport;
import com.techstock.domain.model.LinkApplicationRequest;
import com.techstock.infrastructure.csv.ResourceCsvReader;
import com.techstock.infrastructure.csv.ResourceCsvRow;
import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkEntity;
import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.entity.ResourceTagEntity;
import com.techstock.infrastructure.persistence.entity.SubscriptionEntity;
import com.techstock.infrastructure.persistence.repository.ApplicationRepository;
import com.techstock.infrastructure.persistence.repository.ResourceApplicationLinkRepository;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.ResourceTagRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bulk import of an Azure Resource Graph CSV export.
 *
 * Subscriptions, resource groups and applications referenced by the rows are
 * looked up or created on first sight. The name to id maps only live for one
 * run. Rows missing a required column or carrying an unparseable tag blob
 * are skipped and counted; store failures abort the whole run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceImportService {

    static final String TAG_APP_ID = "AppID";
    static final String TAG_APP_NAME = "AppName";
    static final List<String> TAG_OWNER_EMAIL = List.of("AdminName", "AdminName1", "AdminName2");
    static final String TAG_VENDOR = "Vendor";
    static final String TAG_ENVIRONMENT = "Environment";
    static final String TAG_PROVISIONER = "Provisioner";

    private static final int PROGRESS_INTERVAL = 100;

    private final ResourceCsvReader csvReader;
    private final ResourceRepository resourceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ResourceGroupRepository resourceGroupRepository;
    private final ApplicationRepository applicationRepository;
    private final ResourceTagRepository resourceTagRepository;
    private final ResourceApplicationLinkRepository linkRepository;
    private final TagCodec tagCodec;
    private final DashboardService dashboardService;

    @Transactional
    public ImportReport importCsv(InputStream input) {
        long startTime = System.currentTimeMillis();
        ImportRun run = new ImportRun();

        int unreadable = csvReader.read(input, row -> importRow(row, run));
        run.rowsRead += unreadable;
        run.skipped += unreadable;

        if (run.imported > 0) {
            dashboardService.evictGlobalCounts();
        }

        ImportReport report = ImportReport.builder()
                .rowsRead(run.rowsRead)
                .imported(run.imported)
                .skipped(run.skipped)
                .subscriptionsCreated(run.subscriptionsCreated)
                .resourceGroupsCreated(run.resourceGroupsCreated)
                .applicationsCreated(run.applicationsCreated)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        log.info("Import finished: {} rows read, {} imported, {} skipped in {} ms",
                report.getRowsRead(), report.getImported(), report.getSkipped(), report.getDurationMs());
        return report;
    }

    private void importRow(ResourceCsvRow row, ImportRun run) {
        run.rowsRead++;
        if (run.rowsRead % PROGRESS_INTERVAL == 0) {
            log.info("Processed {} rows", run.rowsRead);
        }

        if (isBlank(row.getName()) || isBlank(row.getType()) || isBlank(row.getLocation())
                || isBlank(row.getSubscription()) || isBlank(row.getResourceGroup())) {
            log.warn("Skipping row {}: missing required column", run.rowsRead);
            run.skipped++;
            return;
        }
        Optional<Map<String, String>> parsedTags = tagCodec.decode(row.getTags());
        if (parsedTags.isEmpty()) {
            log.warn("Skipping row {} ({}): unparseable tags", run.rowsRead, row.getName());
            run.skipped++;
            return;
        }
        Map<String, String> tags = parsedTags.get();

        Long subscriptionId = subscriptionId(row.getSubscription(), run);
        Long resourceGroupId = resourceGroupId(row.getResourceGroup(), subscriptionId, run);
        Long applicationId = tags.containsKey(TAG_APP_ID) ? applicationId(tags, run) : null;

        ResourceEntity resource = resourceRepository.save(ResourceEntity.builder()
                .name(row.getName())
                .resourceType(row.getType())
                .kind(isBlank(row.getKind()) ? null : row.getKind())
                .location(row.getLocation())
                .subscriptionId(subscriptionId)
                .resourceGroupId(resourceGroupId)
                .tagsJson(tagCodec.encode(tags))
                .extendedLocation(isBlank(row.getExtendedLocation()) || "null".equals(row.getExtendedLocation())
                        ? null
                        : row.getExtendedLocation())
                .vendor(tags.get(TAG_VENDOR))
                .environment(tags.get(TAG_ENVIRONMENT))
                .provisioner(tags.get(TAG_PROVISIONER))
                .build());

        if (!tags.isEmpty()) {
            resourceTagRepository.saveAll(tags.entrySet().stream()
                    .map(tag -> ResourceTagEntity.builder()
                            .resourceId(resource.getId())
                            .tagKey(tag.getKey())
                            .tagValue(tag.getValue())
                            .build())
                    .collect(Collectors.toList()));
        }
        if (applicationId != null) {
            linkRepository.save(ResourceApplicationLinkEntity.builder()
                    .resourceId(resource.getId())
                    .applicationId(applicationId)
                    .relationType(LinkApplicationRequest.DEFAULT_RELATION)
                    .build());
        }
        run.imported++;
    }

    private Long subscriptionId(String name, ImportRun run) {
        return run.subscriptions.computeIfAbsent(name, key -> subscriptionRepository.findByName(key)
                .map(SubscriptionEntity::getId)
                .orElseGet(() -> {
                    run.subscriptionsCreated++;
                    return subscriptionRepository.save(SubscriptionEntity.builder().name(key).build()).getId();
                }));
    }

    private Long resourceGroupId(String name, Long subscriptionId, ImportRun run) {
        return run.resourceGroups.computeIfAbsent(subscriptionId + "/" + name,
                key -> resourceGroupRepository.findByNameAndSubscriptionId(name, subscriptionId)
                        .map(ResourceGroupEntity::getId)
                        .orElseGet(() -> {
                            run.resourceGroupsCreated++;
                            return resourceGroupRepository.save(ResourceGroupEntity.builder()
                                    .name(name)
                                    .subscriptionId(subscriptionId)
                                    .build()).getId();
                        }));
    }

    private Long applicationId(Map<String, String> tags, ImportRun run) {
        String code = tags.get(TAG_APP_ID);
        return run.applications.computeIfAbsent(code, key -> applicationRepository.findByCode(key)
                .map(ApplicationEntity::getId)
                .orElseGet(() -> {
                    run.applicationsCreated++;
                    return applicationRepository.save(ApplicationEntity.builder()
                            .code(key)
                            .name(tags.get(TAG_APP_NAME))
                            .ownerEmail(ownerEmail(tags))
                            .build()).getId();
                }));
    }

    /**
     * First admin tag that looks like an email address.
     */
    static String ownerEmail(Map<String, String> tags) {
        return TAG_OWNER_EMAIL.stream()
                .map(tags::get)
                .filter(value -> value != null && value.contains("@"))
                .findFirst()
                .orElse(null);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class ImportRun {
        private final Map<String, Long> subscriptions = new HashMap<>();
        private final Map<String, Long> resourceGroups = new HashMap<>();
        private final Map<String, Long> applications = new HashMap<>();
        private int rowsRead;
        private int imported;
        private int skipped;
        private int subscriptionsCreated;
        private int resourceGroupsCreated;
        private int applicationsCreated;
    }
}
