package loadsim.io;

import loadsim.model.Device;
import loadsim.model.DeviceCatalog;
import loadsim.model.InputDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputDataLoaderTests {

    @TempDir
    Path dir;

    @Test
    @DisplayName("device list and profiles load into a catalog")
    void testLoad() throws Exception {
        Path list = InputFixtures.writeScenario(dir);
        DeviceCatalog c = new InputDataLoader().load(list, dir.resolve("Utilisation profiles"));

        assertEquals(List.of("light", "fan", "tv"), c.getDeviceList());
        assertEquals(100.0, c.getDevice("light").getPowerW());
        // округление до 3 знаков
        assertEquals(60.0, c.getDevice("fan").getPowerW());
        assertEquals(5, c.getDevice("fan").getOwnedCount());
        assertEquals("Entertainment", c.getDevice("tv").getType());
        assertFalse(c.getDevice("tv").isAvailable());
        assertEquals(0, c.getDevice("tv").getEffectiveCount());
        assertEquals(0.8, c.getUtilization("fan", 23, 11));
    }

    @Test
    @DisplayName("columns are found by header name, extra columns ignored")
    void testColumnOrder() throws Exception {
        Path list = InputFixtures.writeDeviceList(dir,
                "Device,Type,Comment,Available,Number,Power (W)\n"
                        + "\"radio, small\",Entertainment,kitchen,y,2,15\n");
        List<Device> devices = new InputDataLoader().loadDevices(list);
        assertEquals(1, devices.size());
        assertEquals("radio, small", devices.get(0).getName());
        assertEquals(15.0, devices.get(0).getPowerW());
        assertEquals(2, devices.get(0).getOwnedCount());
        assertTrue(devices.get(0).isAvailable());
    }

    @Test
    @DisplayName("missing profile file is a data error")
    void testMissingProfile() throws Exception {
        Path list = InputFixtures.writeDeviceList(dir, InputFixtures.DEVICE_LIST);
        Path profiles = dir.resolve("profiles");
        InputFixtures.writeProfile(profiles, "light", 0.3);
        InputFixtures.writeProfile(profiles, "fan", 0.3);

        InputDataException e = assertThrows(InputDataException.class,
                () -> new InputDataLoader().load(list, profiles));
        assertTrue(e.getMessage().contains("tv"));
    }

    @Test
    @DisplayName("probability above 1 in a profile file is rejected")
    void testBadProbability() throws Exception {
        Path profiles = dir.resolve("profiles");
        InputFixtures.writeProfile(profiles, "light", 1.5);
        assertThrows(InputDataException.class, () -> new InputDataLoader().loadProfile(profiles, "light"));
    }

    @Test
    @DisplayName("profile with wrong shape is rejected")
    void testBadShape() throws Exception {
        Path profiles = dir.resolve("profiles");
        InputFixtures.writeProfile(profiles, "short", 0.5, 23, 12);
        InputFixtures.writeProfile(profiles, "narrow", 0.5, 24, 11);
        InputDataLoader loader = new InputDataLoader();
        assertThrows(InputDataException.class, () -> loader.loadProfile(profiles, "short"));
        assertThrows(InputDataException.class, () -> loader.loadProfile(profiles, "narrow"));
    }

    @Test
    @DisplayName("negative number, bad availability and missing columns are rejected")
    void testBadDeviceList() throws Exception {
        InputDataLoader loader = new InputDataLoader();

        Path negative = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nlight,100,-3,Y,Domestic\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(negative));

        Path badFlag = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nlight,100,3,maybe,Domestic\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(badFlag));

        Path fractional = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nlight,100,2.5,Y,Domestic\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(fractional));

        Path noType = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available\nlight,100,3,Y\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(noType));

        Path notNumber = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nlight,abc,3,Y,Domestic\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(notNumber));

        Path tooMany = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nlight,100,3000000000,Y,Domestic\n");
        assertThrows(InputDataException.class, () -> loader.loadDevices(tooMany));
    }

    @Test
    @DisplayName("duplicate device names are rejected")
    void testDuplicate() throws Exception {
        Path list = InputFixtures.writeDeviceList(dir,
                "Device,Power (W),Number,Available,Type\nfan,60,1,Y,D\nfan,60,2,Y,D\n");
        Path profiles = dir.resolve("profiles");
        InputFixtures.writeProfile(profiles, "fan", 0.5);
        assertThrows(InputDataException.class, () -> new InputDataLoader().load(list, profiles));
    }
}
