package com.techstock.domain.service;

import com.techstock.domain.exception.AlreadyExistsException;
import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateApplicationRequest;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.UpdateApplicationRequest;
import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import com.techstock.infrastructure.persistence.repository.ApplicationRepository;
import com.techstock.infrastructure.persistence.repository.ResourceApplicationLinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationService {

    private final ApplicationRepository applicationRepository;
    private final ResourceApplicationLinkRepository linkRepository;

    @Transactional
    public ApplicationEntity createApplication(CreateApplicationRequest request) {
        if (request.getCode() != null) {
            requireCode(request.getCode());
            if (applicationRepository.findByCode(request.getCode()).isPresent()) {
                throw new AlreadyExistsException("Application", "code", request.getCode());
            }
        }
        requireEmail(request.getOwnerEmail());

        ApplicationEntity application = applicationRepository.save(ApplicationEntity.builder()
                .code(request.getCode())
                .name(request.getName())
                .ownerTeam(request.getOwnerTeam())
                .ownerEmail(request.getOwnerEmail())
                .build());

        log.info("Application created: {} ({})", application.getId(), application.getCode());
        return application;
    }

    @Transactional(readOnly = true)
    public ApplicationEntity getApplication(Long id) {
        return applicationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Application", id));
    }

    @Transactional(readOnly = true)
    public Optional<ApplicationEntity> findByCode(String code) {
        return applicationRepository.findByCode(code);
    }

    @Transactional(readOnly = true)
    public List<ApplicationEntity> findByOwnerEmail(String ownerEmail) {
        return applicationRepository.findByOwnerEmailOrderByIdAsc(ownerEmail);
    }

    @Transactional(readOnly = true)
    public PagedResult<ApplicationEntity> listApplications(PaginationParams pagination) {
        if (pagination.getOffset() > Integer.MAX_VALUE) {
            return new PagedResult<>(List.of(),
                    Pagination.of(pagination.getPage(), pagination.getSize(), applicationRepository.count()));
        }
        Page<ApplicationEntity> page = applicationRepository.findAll(
                PageRequest.of(pagination.getPage() - 1, pagination.getSize(), Sort.by("id")));
        return new PagedResult<>(page.getContent(),
                Pagination.of(pagination.getPage(), pagination.getSize(), page.getTotalElements()));
    }

    @Transactional
    public ApplicationEntity updateApplication(Long id, UpdateApplicationRequest request) {
        ApplicationEntity application = getApplication(id);

        if (request.getCode() != null) {
            requireCode(request.getCode());
            applicationRepository.findByCode(request.getCode())
                    .filter(existing -> !existing.getId().equals(id))
                    .ifPresent(existing -> {
                        throw new AlreadyExistsException("Application", "code", request.getCode());
                    });
        }
        requireEmail(request.getOwnerEmail());

        if (request.getCode() != null) application.setCode(request.getCode());
        if (request.getName() != null) application.setName(request.getName());
        if (request.getOwnerTeam() != null) application.setOwnerTeam(request.getOwnerTeam());
        if (request.getOwnerEmail() != null) application.setOwnerEmail(request.getOwnerEmail());

        log.info("Application updated: {}", id);
        return applicationRepository.save(application);
    }

    @Transactional
    public void deleteApplication(Long id) {
        ApplicationEntity application = getApplication(id);
        linkRepository.deleteByApplicationId(id);
        applicationRepository.delete(application);
        log.info("Application deleted: {}", id);
    }

    private static void requireCode(String code) {
        if (code.trim().isEmpty()) {
            throw new InvalidInputException("Application code cannot be empty");
        }
    }

    private static void requireEmail(String email) {
        if (email != null && !email.contains("@")) {
            throw new InvalidInputException("Invalid email format");
        }
    }
}
