package rg.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.core.model.Decision;
import rg.java.engine.RateGuardEngine;
import rg.proto.AdminResponse;
import rg.proto.DecisionResponse;
import rg.proto.HealthCheckRequest;
import rg.proto.HealthCheckResponse;
import rg.proto.ParticipantRequest;
import rg.proto.RateGuardServiceGrpc;
import rg.proto.SessionMemberRequest;
import rg.proto.SessionRequest;

import java.util.function.Supplier;

/**
 * gRPC service implementation over {@link RateGuardEngine}.
 *
 * <p>This is a thin wrapper with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>UNAVAILABLE once the engine has been destroyed</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (Decision → DecisionResponse)</li>
 * </ul>
 *
 * <p>A rejection is a normal response with {@code allowed=false}; mapping it
 * to a user-facing status is the caller's job.
 *
 * <p>Thread-safety: RateGuardEngine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class RateGuardServiceImpl extends RateGuardServiceGrpc.RateGuardServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(RateGuardServiceImpl.class);

    private static final AdminResponse OK = AdminResponse.newBuilder().setOk(true).build();

    private final RateGuardEngine engine;

    /**
     * Creates a new gRPC service wrapping the given engine.
     *
     * @param engine Rate guard engine (must be thread-safe)
     * @throws IllegalArgumentException if engine is null
     */
    public RateGuardServiceImpl(RateGuardEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    @Override
    public void checkIdeaSubmission(ParticipantRequest request, StreamObserver<DecisionResponse> responseObserver) {
        if (rejectEmpty(request.getParticipantId(), "participant_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> toResponse(engine.checkIdeaSubmission(request.getParticipantId())));
    }

    @Override
    public void checkParticipantJoin(SessionMemberRequest request, StreamObserver<DecisionResponse> responseObserver) {
        if (rejectEmpty(request.getSessionId(), "session_id", responseObserver)
            || rejectEmpty(request.getParticipantId(), "participant_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> toResponse(
            engine.checkParticipantJoin(request.getSessionId(), request.getParticipantId())));
    }

    @Override
    public void leaveSession(SessionMemberRequest request, StreamObserver<AdminResponse> responseObserver) {
        if (rejectEmpty(request.getSessionId(), "session_id", responseObserver)
            || rejectEmpty(request.getParticipantId(), "participant_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> {
            engine.leaveSession(request.getSessionId(), request.getParticipantId());
            return OK;
        });
    }

    @Override
    public void getStatus(ParticipantRequest request, StreamObserver<DecisionResponse> responseObserver) {
        if (rejectEmpty(request.getParticipantId(), "participant_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> toResponse(engine.getStatus(request.getParticipantId())));
    }

    @Override
    public void reset(ParticipantRequest request, StreamObserver<AdminResponse> responseObserver) {
        if (rejectEmpty(request.getParticipantId(), "participant_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> {
            engine.reset(request.getParticipantId());
            return OK;
        });
    }

    @Override
    public void clearSession(SessionRequest request, StreamObserver<AdminResponse> responseObserver) {
        if (rejectEmpty(request.getSessionId(), "session_id", responseObserver)) {
            return;
        }
        respond(responseObserver, () -> {
            engine.clearSession(request.getSessionId());
            return OK;
        });
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(engine.isDestroyed()
                ? HealthCheckResponse.Status.NOT_SERVING
                : HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    static DecisionResponse toResponse(Decision decision) {
        DecisionResponse.Builder builder = DecisionResponse.newBuilder()
            .setAllowed(decision.allowed())
            .setRemaining(decision.remaining())
            .setResetInMillis(decision.resetInMillis());
        decision.retryAfter().ifPresent(builder::setRetryAfterMillis);
        decision.rejectionReason().ifPresent(builder::setReason);
        return builder.build();
    }

    // Protobuf strings are never null, only empty
    private static boolean rejectEmpty(String value, String field, StreamObserver<?> responseObserver) {
        if (!value.isEmpty()) {
            return false;
        }
        responseObserver.onError(
            Status.INVALID_ARGUMENT
                .withDescription(field + " must not be empty")
                .asRuntimeException()
        );
        return true;
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (IllegalStateException e) {
            responseObserver.onError(
                Status.UNAVAILABLE
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (Exception e) {
            log.error("Unexpected error handling rate guard call", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
