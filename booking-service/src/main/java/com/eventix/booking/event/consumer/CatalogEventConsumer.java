package com.eventix.booking.event.consumer;

import com.eventix.booking.discount.DiscountType;
import com.eventix.booking.domain.LocalEvent;
import com.eventix.booking.domain.TicketType;
import com.eventix.booking.domain.Voucher;
import com.eventix.booking.event.IdempotencyService;
import com.eventix.booking.inventory.InventoryLedger;
import com.eventix.booking.repository.LocalEventRepository;
import com.eventix.booking.repository.TicketTypeRepository;
import com.eventix.booking.repository.VoucherRepository;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.booking.uow.UnitOfWorkTemplate;
import com.eventix.common.event.EventCatalogSyncedEvent;
import com.eventix.common.event.EventCatalogSyncedEvent.TicketTypeInfo;
import com.eventix.common.event.EventCatalogSyncedEvent.VoucherInfo;
import com.eventix.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Consumes catalog events to keep the local event, ticket type and voucher replicas in sync.
 * Ledger counters ({@code reserved}, {@code booked_seats}, {@code used_count}) are never written here;
 * capacity changes go through InventoryLedger so they cannot drop below what is already sold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogEventConsumer {

    private final UnitOfWorkTemplate unitOfWork;
    private final LocalEventRepository localEventRepository;
    private final TicketTypeRepository ticketTypeRepository;
    private final VoucherRepository voucherRepository;
    private final InventoryLedger inventoryLedger;
    private final IdempotencyService idempotencyService;

    @KafkaListener(topics = Topics.CATALOG_EVENT_SYNCED, groupId = "booking-service")
    public void handleCatalogSynced(EventCatalogSyncedEvent event) {
        unitOfWork.run(uow -> {
            if (idempotencyService.isDuplicate(event)) {
                log.debug("Duplicate catalog-synced event skipped: eventId={}", event.getEventId());
                return;
            }

            List<TicketTypeInfo> ticketTypes = event.getTicketTypes() != null ? event.getTicketTypes() : List.of();
            List<VoucherInfo> vouchers = event.getVouchers() != null ? event.getVouchers() : List.of();
            log.info("Received catalog-synced event: catalogEventId={}, ticketTypes={}, vouchers={}",
                    event.getCatalogEventId(), ticketTypes.size(), vouchers.size());

            syncEvent(uow, event, ticketTypes);
            ticketTypes.forEach(info -> syncTicketType(uow, event.getCatalogEventId(), info));
            vouchers.forEach(info -> syncVoucher(event.getCatalogEventId(), info));

            idempotencyService.markProcessed(event, Topics.CATALOG_EVENT_SYNCED);
        });
    }

    private void syncEvent(UnitOfWork uow, EventCatalogSyncedEvent event, List<TicketTypeInfo> ticketTypes) {
        // Without an explicit seat budget the event holds exactly its ticket types' capacity
        int seatBudget = event.getAvailableSeats() != null
                ? event.getAvailableSeats()
                : ticketTypes.stream().mapToInt(t -> t.getCapacity() != null ? t.getCapacity() : 0).sum();

        localEventRepository.findById(event.getCatalogEventId())
                .ifPresentOrElse(
                        existing -> {
                            existing.updateFrom(event.getOrganizerId(), event.getTitle(),
                                    event.getStartDate(), event.isPublished());
                            localEventRepository.save(existing);
                            if (existing.getAvailableSeats() != seatBudget
                                    && !inventoryLedger.resizeSeatBudget(uow, existing.getId(), seatBudget)) {
                                log.warn("Seat budget not reduced below booked seats: eventId={}, requested={}, booked={}",
                                        existing.getId(), seatBudget, existing.getBookedSeats());
                            }
                        },
                        () -> {
                            localEventRepository.save(new LocalEvent(
                                    event.getCatalogEventId(), event.getOrganizerId(), event.getTitle(),
                                    event.getStartDate(), event.isPublished(), seatBudget));
                            log.info("Created local event replica: eventId={}", event.getCatalogEventId());
                        }
                );
    }

    private void syncTicketType(UnitOfWork uow, Long eventId, TicketTypeInfo info) {
        int capacity = info.getCapacity() != null ? info.getCapacity() : 0;
        ticketTypeRepository.findById(info.getTicketTypeId())
                .ifPresentOrElse(
                        existing -> {
                            existing.updateFrom(info.getName(), info.getPrice());
                            ticketTypeRepository.save(existing);
                            if (existing.getCapacity() != capacity
                                    && !inventoryLedger.resizeTicketType(uow, existing.getId(), capacity)) {
                                log.warn("Capacity not reduced below reserved: ticketTypeId={}, requested={}, reserved={}",
                                        existing.getId(), capacity, existing.getReserved());
                            }
                        },
                        () -> ticketTypeRepository.save(new TicketType(
                                info.getTicketTypeId(), eventId, info.getName(), info.getPrice(), capacity))
                );
    }

    private void syncVoucher(Long eventId, VoucherInfo info) {
        DiscountType discountType = DiscountType.valueOf(info.getDiscountType().toUpperCase());
        int maxUsage = info.getMaxUsage() != null ? info.getMaxUsage() : Integer.MAX_VALUE;
        voucherRepository.findById(info.getVoucherId())
                .ifPresentOrElse(
                        existing -> {
                            existing.updateFrom(discountType, info.getDiscountValue(),
                                    info.getMaxDiscountAmount(), info.getMinPurchaseAmount(),
                                    maxUsage, info.getStartDate(), info.getEndDate());
                            voucherRepository.save(existing);
                        },
                        () -> voucherRepository.save(new Voucher(
                                info.getVoucherId(), eventId, info.getCode(), discountType,
                                info.getDiscountValue(), info.getMaxDiscountAmount(), info.getMinPurchaseAmount(),
                                maxUsage, info.getStartDate(), info.getEndDate()))
                );
    }
}
