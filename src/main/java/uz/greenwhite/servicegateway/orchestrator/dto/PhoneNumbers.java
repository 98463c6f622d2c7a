package uz.greenwhite.servicegateway.orchestrator.dto;

final class PhoneNumbers {

    static final String E164 = "^\\+?[1-9]\\d{1,14}$";

    private PhoneNumbers() {
    }
}
