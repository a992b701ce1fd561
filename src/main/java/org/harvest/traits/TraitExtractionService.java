package org.harvest.traits;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.harvest.exception.RemoteServiceException;
import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.adapter.AdapterRegistry;
import org.harvest.traits.adapter.Backend;
import org.harvest.traits.adapter.ExtractionAdapter;
import org.harvest.traits.adapter.NormalizedTriple;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.document.DoiHasher;
import org.harvest.traits.document.TraitDocument;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.ExtractionJobWorker;
import org.harvest.traits.job.ExtractionMode;
import org.harvest.traits.job.JobResults;
import org.harvest.traits.job.JobStatus;
import org.harvest.traits.job.JobUpdate;
import org.harvest.traits.profile.ModelProfile;
import org.harvest.traits.profile.ModelProfileRegistry;
import org.harvest.traits.profile.ModelProfileSummary;
import org.harvest.traits.remote.ExtractTriplesRequest;
import org.harvest.traits.remote.ExtractTriplesResponse;
import org.harvest.traits.remote.RemoteDocument;
import org.harvest.traits.remote.RemoteExtractionClient;
import org.harvest.traits.remote.RemoteTriple;
import org.harvest.traits.storage.DocumentRepositoryPort;
import org.harvest.traits.storage.ExtractionJobRepositoryPort;
import org.harvest.traits.storage.Page;
import org.harvest.traits.storage.TripleRepositoryPort;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleQuery;
import org.harvest.traits.triple.TripleStatus;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

/**
 * Orchestrates trait extraction jobs over stored documents.
 *
 * <p>In local mode documents are run through an adapter from the
 * {@link AdapterRegistry}. In remote mode the whole batch is delegated to a peer
 * extraction server. Either way, triples are persisted in one batch when the
 * job completes, and a failed job persists nothing.
 */
@ApplicationScoped
public class TraitExtractionService {

    private static final Logger LOG = Logger.getLogger(TraitExtractionService.class);

    static final int SENTENCE_SNIPPET_LENGTH = 200;
    static final String REMOTE_ERROR_PREFIX = "Remote server error: ";

    private final ModelProfileRegistry profiles;
    private final AdapterRegistry adapters;
    private final DocumentRepositoryPort documents;
    private final ExtractionJobRepositoryPort jobs;
    private final TripleRepositoryPort triples;
    private final RemoteExtractionClient remoteClient;
    private final ExtractionJobWorker worker;
    private final boolean localMode;

    /**
     * Default constructor for CDI proxy.
     */
    public TraitExtractionService() {
        this.profiles = null;
        this.adapters = null;
        this.documents = null;
        this.jobs = null;
        this.triples = null;
        this.remoteClient = null;
        this.worker = null;
        this.localMode = true;
    }

    @Inject
    public TraitExtractionService(
            ModelProfileRegistry profiles,
            AdapterRegistry adapters,
            DocumentRepositoryPort documents,
            ExtractionJobRepositoryPort jobs,
            TripleRepositoryPort triples,
            @RestClient RemoteExtractionClient remoteClient,
            ExtractionJobWorker worker,
            @ConfigProperty(name = "trait-extraction.local-mode", defaultValue = "true") boolean localMode) {
        this.profiles = profiles;
        this.adapters = adapters;
        this.documents = documents;
        this.jobs = jobs;
        this.triples = triples;
        this.remoteClient = remoteClient;
        this.worker = worker;
        this.localMode = localMode;
    }

    public JobResult extractFromDocuments(List<Long> documentIds, String modelProfile,
            Long projectId, String createdBy) {
        return extractFromDocuments(documentIds, modelProfile, projectId, createdBy, ExtractionMode.NO_TRAINING);
    }

    /**
     * Creates a job and runs it to completion on the calling thread.
     *
     * @param documentIds documents to process, in order; may be empty
     * @param modelProfile profile to extract with
     * @param projectId owning project, may be null
     * @param createdBy requesting user, may be null
     * @param mode extraction mode recorded on the job
     * @return the final state of the job
     * @throws org.harvest.exception.ConfigurationException if the profile or its backend is unknown; no job is created
     */
    public JobResult extractFromDocuments(List<Long> documentIds, String modelProfile,
            Long projectId, String createdBy, ExtractionMode mode) {
        final ExtractionJob job = createJob(documentIds, modelProfile, projectId, createdBy, mode);
        return execute(job.id());
    }

    /**
     * Creates a pending job and queues it on the background worker.
     *
     * @return the job as created, still pending
     */
    public ExtractionJob submitExtraction(List<Long> documentIds, String modelProfile,
            Long projectId, String createdBy, ExtractionMode mode) {
        final ExtractionJob job = createJob(documentIds, modelProfile, projectId, createdBy, mode);
        worker.submit(job.id(), () -> execute(job.id()));
        return job;
    }

    /**
     * Runs a pending job. A job that is no longer pending, for example because it
     * was cancelled while queued, is left untouched.
     *
     * @param jobId job to run
     * @return the final state of the job
     */
    public JobResult execute(long jobId) {
        final ExtractionJob job = jobs.findById(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Extraction job not found: " + jobId));
        if (job.status() != JobStatus.PENDING) {
            LOG.infof("Skipping job %d in status %s", jobId, job.status());
            return JobResult.of(job);
        }
        final ExtractionJob running;
        try {
            running = jobs.update(jobId, JobUpdate.started(Instant.now()));
        } catch (IllegalStateException e) {
            LOG.infof("Job %d could not be started: %s", jobId, e.getMessage());
            return JobResult.of(jobs.findById(jobId).orElse(job));
        }

        LOG.infof("Running job %d with profile %s on %d document(s) (%s mode)",
            jobId, running.modelProfile(), running.total(), localMode ? "local" : "remote");
        return localMode ? runLocal(running) : runRemote(running);
    }

    public Optional<ExtractionJob> getJobStatus(long jobId) {
        return jobs.findById(jobId);
    }

    public Page<ExtractionJob> listJobs(Long projectId, JobStatus status, int page, int perPage) {
        return jobs.findAll(projectId, status, page, perPage);
    }

    /**
     * Cancels a job that has not started yet.
     *
     * @throws ResourceNotFoundException if the job does not exist
     * @throws IllegalStateException if the job is no longer pending
     */
    public ExtractionJob cancelJob(long jobId) {
        final ExtractionJob job = jobs.findById(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Extraction job not found: " + jobId));
        if (job.status() != JobStatus.PENDING) {
            throw new IllegalStateException("Only pending jobs can be cancelled, job " + jobId + " is " + job.status());
        }
        final ExtractionJob cancelled = jobs.update(jobId, JobUpdate.cancelled(Instant.now()));
        LOG.infof("Cancelled job %d", jobId);
        return cancelled;
    }

    public List<ModelProfileSummary> listModelProfiles() {
        return profiles.list();
    }

    public Page<ExtractedTriple> listTriples(TripleQuery query) {
        return triples.findAll(query);
    }

    public ExtractedTriple reviewTriple(long tripleId, TripleStatus status, TripleEdits edits) {
        if (status == null) {
            throw new IllegalArgumentException("Review status is required");
        }
        if (status == TripleStatus.EDITED && (edits == null || edits.isEmpty())) {
            throw new IllegalArgumentException("An edited triple needs at least one corrected field");
        }
        return triples.updateStatus(tripleId, status, edits == null ? TripleEdits.none() : edits);
    }

    private ExtractionJob createJob(List<Long> documentIds, String modelProfile,
            Long projectId, String createdBy, ExtractionMode mode) {
        if (documentIds == null) {
            throw new IllegalArgumentException("Document ids are required");
        }
        Backend.fromTag(profiles.require(modelProfile).backend());
        final ExtractionJob job = jobs.create(projectId, List.copyOf(documentIds), modelProfile,
            mode == null ? ExtractionMode.NO_TRAINING : mode, createdBy);
        LOG.infof("Created extraction job %d for %d document(s)", job.id(), job.total());
        return job;
    }

    private JobResult runLocal(ExtractionJob job) {
        final List<ExtractedTriple> buffer = new ArrayList<>();
        try {
            final ModelProfile profile = profiles.require(job.modelProfile());
            final ExtractionAdapter adapter = adapters.get(profile.id(), profile);
            adapter.load();

            int progress = 0;
            for (Long documentId : job.documentIds()) {
                final Optional<TraitDocument> document = documents.findById(documentId);
                if (document.isEmpty() || !document.get().hasText()) {
                    LOG.warnf("Job %d: document %d is missing or has no text, skipping", job.id(), documentId);
                } else {
                    buffer.addAll(extractDocument(job, adapter, document.get()));
                }
                progress++;
                jobs.update(job.id(), JobUpdate.progress(progress));
            }

            triples.insertBatch(buffer);
            final ExtractionJob completed = jobs.update(job.id(),
                JobUpdate.completed(progress, new JobResults(buffer.size()), Instant.now()));
            LOG.infof("Job %d completed with %d triple(s)", job.id(), buffer.size());
            return JobResult.of(completed);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job %d failed", job.id());
            return markFailed(job.id(), e.getMessage());
        }
    }

    private List<ExtractedTriple> extractDocument(ExtractionJob job, ExtractionAdapter adapter,
            TraitDocument document) {
        final String text = document.getTextContent();
        final List<RawTriple> raws = adapter.extract(List.of(text)).get(0);
        final String doiHash = document.getDoiHash() != null ? document.getDoiHash() : DoiHasher.hash(document.getDoi());
        final List<ExtractedTriple> extracted = new ArrayList<>(raws.size());
        for (RawTriple raw : raws) {
            final ExtractedTriple triple = ExtractedTriple.from(adapter.normalize(raw));
            triple.setJobId(job.id());
            triple.setDocumentId(document.getId());
            triple.setProjectId(document.getProjectId() != null ? document.getProjectId() : job.projectId());
            triple.setModelProfile(job.modelProfile());
            triple.setSentence(raw.sentence() != null && !raw.sentence().isBlank() ? raw.sentence() : snippet(text));
            triple.setDoiHash(doiHash);
            triple.setContributorEmail(job.createdBy());
            extracted.add(triple);
        }
        LOG.debugf("Job %d: document %d produced %d triple(s)", Long.valueOf(job.id()), document.getId(),
            Integer.valueOf(extracted.size()));
        return extracted;
    }

    private JobResult runRemote(ExtractionJob job) {
        try {
            final Map<Long, TraitDocument> byId = new LinkedHashMap<>();
            final List<RemoteDocument> payload = new ArrayList<>();
            for (Long documentId : job.documentIds()) {
                final Optional<TraitDocument> found = documents.findById(documentId);
                if (found.isEmpty()) {
                    LOG.warnf("Job %d: document %d not found, not sent to the remote server", job.id(), documentId);
                    continue;
                }
                final TraitDocument document = found.get();
                byId.put(documentId, document);
                payload.add(new RemoteDocument(documentId,
                    document.getTextContent() == null ? "" : document.getTextContent(),
                    metadataOf(document)));
            }

            final ExtractTriplesResponse response = remoteClient.extractTriples(
                new ExtractTriplesRequest(payload, job.modelProfile(), job.id()));

            final List<ExtractedTriple> buffer = new ArrayList<>(response.triples().size());
            for (RemoteTriple remote : response.triples()) {
                buffer.add(fromRemote(job, remote, byId.get(remote.documentId())));
            }

            triples.insertBatch(buffer);
            final ExtractionJob completed = jobs.update(job.id(),
                JobUpdate.completed(job.total(), new JobResults(buffer.size()), Instant.now()));
            LOG.infof("Job %d completed remotely with %d triple(s)", job.id(), buffer.size());
            return JobResult.of(completed);
        } catch (ProcessingException | WebApplicationException | RemoteServiceException e) {
            LOG.errorf(e, "Job %d failed on the remote server", job.id());
            return markFailed(job.id(), REMOTE_ERROR_PREFIX + e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job %d failed", job.id());
            return markFailed(job.id(), e.getMessage());
        }
    }

    private ExtractedTriple fromRemote(ExtractionJob job, RemoteTriple remote, TraitDocument document) {
        final NormalizedTriple normalized = remote.normalized();
        final ExtractedTriple triple = ExtractedTriple.from(normalized);
        triple.setJobId(job.id());
        triple.setDocumentId(remote.documentId());
        triple.setModelProfile(remote.modelProfile() != null ? remote.modelProfile() : job.modelProfile());
        triple.setContributorEmail(job.createdBy());
        if (document != null) {
            triple.setProjectId(document.getProjectId() != null ? document.getProjectId() : job.projectId());
            triple.setDoiHash(document.getDoiHash() != null ? document.getDoiHash() : DoiHasher.hash(document.getDoi()));
        } else {
            triple.setProjectId(remote.projectId() != null ? remote.projectId() : job.projectId());
            triple.setDoiHash(DoiHasher.hash(remote.doi()));
        }
        if (remote.sentence() != null && !remote.sentence().isBlank()) {
            triple.setSentence(remote.sentence());
        } else if (document != null && document.hasText()) {
            triple.setSentence(snippet(document.getTextContent()));
        }
        return triple;
    }

    private JobResult markFailed(long jobId, String message) {
        final String errorMessage = message != null ? message : "Extraction failed";
        try {
            return JobResult.of(jobs.update(jobId, JobUpdate.failed(errorMessage, Instant.now())));
        } catch (IllegalStateException e) {
            LOG.errorf(e, "Could not mark job %d as failed", jobId);
            return new JobResult(jobId, JobStatus.FAILED, null, errorMessage);
        }
    }

    private static Map<String, Object> metadataOf(TraitDocument document) {
        final Map<String, Object> metadata = new HashMap<>();
        if (document.getProjectId() != null) {
            metadata.put("project_id", document.getProjectId());
        }
        if (document.getDoi() != null) {
            metadata.put("doi", document.getDoi());
        }
        return metadata;
    }

    static String snippet(String text) {
        return text.length() <= SENTENCE_SNIPPET_LENGTH ? text : text.substring(0, SENTENCE_SNIPPET_LENGTH);
    }
}
