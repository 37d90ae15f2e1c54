package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.TestFixtures;
import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.domain.Booking;
import com.courtbook.court.domain.BookingStatus;
import com.courtbook.court.domain.Club;
import com.courtbook.court.domain.ClubBusinessHours;
import com.courtbook.court.domain.ClubSpecialHours;
import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.ResolvedPrice;
import com.courtbook.court.domain.SportType;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.request.SlotQuery;
import com.courtbook.court.dto.response.AvailableCourtResponse;
import com.courtbook.court.dto.response.AvailableCourtsResponse;
import com.courtbook.court.repository.BookingRepository;
import com.courtbook.court.repository.ClubRepository;
import com.courtbook.court.repository.ClubSpecialHoursRepository;
import com.courtbook.court.repository.CourtRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    private static final Long CLUB_ID = 1L;
    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Mock
    private ClubRepository clubRepository;
    @Mock
    private CourtRepository courtRepository;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private ClubSpecialHoursRepository specialHoursRepository;
    @Mock
    private PriceResolver priceResolver;

    private AvailabilityService availabilityService;
    private Club club;

    @BeforeEach
    void setUp() {
        AvailabilityProperties properties = new AvailabilityProperties();
        availabilityService = new AvailabilityService(clubRepository, courtRepository, bookingRepository,
                new BusinessHoursResolver(specialHoursRepository, properties), priceResolver, properties);
        club = TestFixtures.createClub(CLUB_ID);
    }

    @Test
    void findAvailableCourts_noBookings_courtAvailableAtDefaultPrice() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings();
        givenDefaultPrices(court);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("21:00", 60), null);

        assertThat(response.availableCourts()).hasSize(1);
        AvailableCourtResponse available = response.availableCourts().get(0);
        assertThat(available.id()).isEqualTo(10L);
        assertThat(available.slug()).isEqualTo("court-10");
        assertThat(available.indoor()).isTrue();
        assertThat(available.sportType()).isEqualTo("PADEL");
        assertThat(available.defaultPriceCents()).isEqualTo(3000);
        assertThat(available.priceCents()).isEqualTo(3000);
    }

    @Test
    void findAvailableCourts_slotEndingAfterClose_returnsEmpty() {
        when(clubRepository.findByIdWithBusinessHours(CLUB_ID)).thenReturn(Optional.of(club));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("22:00", 60), null);

        assertThat(response.availableCourts()).isEmpty();
        verifyNoInteractions(courtRepository, bookingRepository, priceResolver);
    }

    @Test
    void findAvailableCourts_slotStartingBeforeOpen_returnsEmpty() {
        when(clubRepository.findByIdWithBusinessHours(CLUB_ID)).thenReturn(Optional.of(club));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("08:30", 60), null);

        assertThat(response.availableCourts()).isEmpty();
    }

    @Test
    void findAvailableCourts_overlappingLiveBooking_excludesCourt() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings(TestFixtures.createBooking(10L, DATE, "10:30", "11:30", BookingStatus.PAID));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).isEmpty();
        verifyNoInteractions(priceResolver);
    }

    @Test
    void findAvailableCourts_touchingBooking_keepsCourt() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings(TestFixtures.createBooking(10L, DATE, "08:00", "10:00", BookingStatus.CONFIRMED));
        givenDefaultPrices(court);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).extracting(AvailableCourtResponse::id).containsExactly(10L);
    }

    @Test
    void findAvailableCourts_cancelledAndNoShowBookings_neverBlock() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings(
                TestFixtures.createBooking(10L, DATE, "10:00", "11:00", BookingStatus.CANCELLED),
                TestFixtures.createBooking(10L, DATE, "09:30", "12:00", BookingStatus.NO_SHOW));
        givenDefaultPrices(court);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).hasSize(1);
    }

    @Test
    void findAvailableCourts_pendingBooking_blocks() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings(TestFixtures.createBooking(10L, DATE, "10:00", "11:00", BookingStatus.PENDING));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:30", 30), null);

        assertThat(response.availableCourts()).isEmpty();
    }

    @Test
    void findAvailableCourts_keepsCourtOrderAndOnlyExcludesBookedCourt() {
        Court first = TestFixtures.createCourt(10L, club, 3000);
        Court second = TestFixtures.createCourt(11L, club, 3000);
        Court third = TestFixtures.createCourt(12L, club, 3000);
        givenClubWithCourts(first, second, third);
        givenBookings(TestFixtures.createBooking(11L, DATE, "10:00", "11:00", BookingStatus.RESERVED));
        givenDefaultPrices(first, third);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).extracting(AvailableCourtResponse::id).containsExactly(10L, 12L);
    }

    @Test
    void findAvailableCourts_attachesResolvedPrice() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings();
        when(priceResolver.resolve(eq(court), eq(DATE), any(TimeRange.class)))
                .thenReturn(new ResolvedPrice(2500, null));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("18:00", 60), null);

        assertThat(response.availableCourts().get(0).priceCents()).isEqualTo(2500);
    }

    @Test
    void findAvailableCourts_priceResolutionFails_usesProratedDefault() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        givenBookings();
        when(priceResolver.resolve(eq(court), eq(DATE), any(TimeRange.class)))
                .thenThrow(new IllegalStateException("Corrupt price rule id=3"));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 90), null);

        assertThat(response.availableCourts()).hasSize(1);
        assertThat(response.availableCourts().get(0).priceCents()).isEqualTo(4500);
    }

    @Test
    void findAvailableCourts_unknownClub_throwsNotFound() {
        when(clubRepository.findByIdWithBusinessHours(CLUB_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CLUB_NOT_FOUND);
    }

    @Test
    void findAvailableCourts_clubWithoutCourts_returnsEmpty() {
        givenClubWithCourts();

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).isEmpty();
        verify(bookingRepository, never()).findOverlapping(any(), any(), any());
    }

    @Test
    void findAvailableCourts_sportTypeFilter_keepsMatchingCourts() {
        Court padel = TestFixtures.createCourt(10L, club, 3000, SportType.PADEL);
        Court tennis = TestFixtures.createCourt(11L, club, 4000, SportType.TENNIS);
        givenClubWithCourts(padel, tennis);
        givenBookings();
        givenDefaultPrices(tennis);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(
                CLUB_ID, query("10:00", 60), SportType.TENNIS);

        assertThat(response.availableCourts()).extracting(AvailableCourtResponse::id).containsExactly(11L);
    }

    @Test
    void findAvailableCourts_unpublishedCourt_isNotOffered() {
        Court published = TestFixtures.createCourt(10L, club, 3000);
        Court hidden = Court.builder()
                .club(club)
                .name("Coaching court")
                .sportType(SportType.PADEL)
                .defaultPriceCents(3000)
                .published(false)
                .build();
        TestFixtures.setEntityId(hidden, 11L);
        givenClubWithCourts(published, hidden);
        givenBookings();
        givenDefaultPrices(published);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).extracting(AvailableCourtResponse::id).containsExactly(10L);
        verify(priceResolver, never()).resolve(eq(hidden), any(), any());
    }

    @Test
    void findAvailableCourts_weeklyClosedDay_returnsEmpty() {
        club.addBusinessHours(ClubBusinessHours.builder().club(club).dayOfWeek(1).closed(true).build());
        when(clubRepository.findByIdWithBusinessHours(CLUB_ID)).thenReturn(Optional.of(club));

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("10:00", 60), null);

        assertThat(response.availableCourts()).isEmpty();
        verifyNoInteractions(courtRepository);
    }

    @Test
    void findAvailableCourts_specialHours_extendBookableWindow() {
        Court court = TestFixtures.createCourt(10L, club, 3000);
        givenClubWithCourts(court);
        when(specialHoursRepository.findByClubIdAndDate(CLUB_ID, DATE)).thenReturn(Optional.of(
                ClubSpecialHours.builder().club(club).date(DATE).openTime("08:00").closeTime("23:00").build()));
        givenBookings();
        givenDefaultPrices(court);

        AvailableCourtsResponse response = availabilityService.findAvailableCourts(CLUB_ID, query("22:00", 60), null);

        assertThat(response.availableCourts()).hasSize(1);
    }

    private static SlotQuery query(String start, int duration) {
        return new SlotQuery(DATE, TimeRange.startingAt(start, duration));
    }

    private void givenClubWithCourts(Court... courts) {
        when(clubRepository.findByIdWithBusinessHours(CLUB_ID)).thenReturn(Optional.of(club));
        when(courtRepository.findByClubIdAndActiveTrueOrderByIdAsc(CLUB_ID)).thenReturn(List.of(courts));
    }

    private void givenBookings(Booking... bookings) {
        when(bookingRepository.findOverlapping(any(), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(bookings));
    }

    private void givenDefaultPrices(Court... courts) {
        for (Court court : courts) {
            when(priceResolver.resolve(eq(court), eq(DATE), any(TimeRange.class)))
                    .thenAnswer(inv -> ResolvedPrice.fromDefault(court, inv.getArgument(2)));
        }
    }
}
