package io.github.drompincen.screencontrol.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Screen, pointer and keyboard primitives consumed by the GUI tools. Operations the
 * platform cannot provide throw {@link UnsupportedOperationException}.
 */
public interface AutomationProvider {

    JsonNode checkPermissions();

    JsonNode listApplications();

    JsonNode focusApplication(String identifier);

    JsonNode launchApplication(String identifier);

    JsonNode closeApplication(String identifier, boolean force);

    JsonNode currentApplication();

    /** PNG bytes of the whole desktop. */
    byte[] screenshot();

    /** PNG bytes of one application window; {@code identifier} may be null for the focused one. */
    byte[] screenshotApplication(String identifier);

    void click(int x, int y, String button, boolean relativeToApp);

    void doubleClick(int x, int y);

    void moveMouse(int x, int y);

    JsonNode mousePosition();

    void scroll(int deltaX, int deltaY, Integer x, Integer y);

    void drag(int startX, int startY, int endX, int endY);

    void typeText(String text);

    void pressKey(String key);

    JsonNode clickableElements();

    JsonNode uiElements();

    JsonNode clickElement(int elementIndex);

    JsonNode analyzeWithOcr();
}
