package org.be.activityservice.exception;

public class CountryNotFoundException extends ActivityException {

    public CountryNotFoundException(String countryCode) {
        super("No events found for country: " + countryCode);
    }
}
