package com.vesselintel.photos.http;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.support.FakeSite;
import com.vesselintel.photos.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserSessionPoolTest {

    private static BrowserSessionPool poolOf(BrowserSessionFactory factory, int size) {
        PhotoScraperProperties properties = TestProperties.fast();
        properties.getConcurrency().setSessionPoolSize(size);
        return new BrowserSessionPool(factory, properties);
    }

    @Test
    @DisplayName("Slots are filled lazily and handed out round-robin")
    void acquire_roundRobin() throws Exception {
        FakeSite site = new FakeSite(url -> FakeSite.status(url, 200));
        BrowserSessionPool pool = poolOf(site, 2);

        BrowserSessionPool.Lease first = pool.acquire();
        BrowserSessionPool.Lease second = pool.acquire();
        BrowserSessionPool.Lease third = pool.acquire();

        assertThat(first.slot()).isZero();
        assertThat(second.slot()).isEqualTo(1);
        assertThat(third.slot()).isZero();
        assertThat(third.session()).isSameAs(first.session());
        assertThat(site.sessionsCreated()).isEqualTo(2);
    }

    @Test
    @DisplayName("Recreate replaces only the failed session")
    void recreate_replacesFailedSession() throws Exception {
        FakeSite site = new FakeSite(url -> FakeSite.status(url, 200));
        BrowserSessionPool pool = poolOf(site, 2);
        BrowserSessionPool.Lease slot0 = pool.acquire();
        BrowserSessionPool.Lease slot1 = pool.acquire();

        BrowserSession fresh = pool.recreate(slot0);

        assertThat(fresh).isNotSameAs(slot0.session());
        assertThat(pool.acquire().session()).isSameAs(fresh);
        assertThat(pool.acquire().session()).isSameAs(slot1.session());
    }

    @Test
    @DisplayName("A stale lease does not replace a session another thread already rebuilt")
    void recreate_staleLeaseKeepsNewerSession() throws Exception {
        FakeSite site = new FakeSite(url -> FakeSite.status(url, 200));
        BrowserSessionPool pool = poolOf(site, 1);
        BrowserSessionPool.Lease lease = pool.acquire();

        BrowserSession rebuilt = pool.recreate(lease);
        BrowserSession again = pool.recreate(lease);

        assertThat(again).isSameAs(rebuilt);
        assertThat(site.sessionsCreated()).isEqualTo(2);
    }

    @Test
    @DisplayName("A failed re-establishment leaves the slot empty for the next acquire")
    void recreate_failureLeavesSlotEmpty() throws Exception {
        BrowserSessionFactory factory = mock(BrowserSessionFactory.class);
        BrowserSession original = mock(BrowserSession.class);
        BrowserSession replacement = mock(BrowserSession.class);
        when(factory.create())
                .thenReturn(original)
                .thenThrow(new IOException("challenge not passed"))
                .thenReturn(replacement);
        BrowserSessionPool pool = poolOf(factory, 1);

        BrowserSessionPool.Lease lease = pool.acquire();
        assertThatThrownBy(() -> pool.recreate(lease)).isInstanceOf(IOException.class);

        assertThat(pool.acquire().session()).isSameAs(replacement);
        verify(factory, times(3)).create();
    }
}
