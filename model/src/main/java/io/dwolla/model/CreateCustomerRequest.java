package io.dwolla.model;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /customers}. Only the fields needed for an unverified or receive-only
 * customer are modelled.
 *
 * @param firstName first name
 * @param lastName last name
 * @param email email address, unique per application
 * @param type customer type; the API defaults to {@code unverified} when absent
 * @param businessName optional business name
 * @param ipAddress optional IP address of the end user
 * @param correlationId optional caller reference stored with the customer
 */
public record CreateCustomerRequest(String firstName, String lastName, String email,
                                    @Nullable String type, @Nullable String businessName,
                                    @Nullable String ipAddress, @Nullable String correlationId) {

    public CreateCustomerRequest {
        Assert.checkNotNullParam("firstName", firstName);
        Assert.checkNotNullParam("lastName", lastName);
        Assert.checkNotNullParam("email", email);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable String firstName;
        private @Nullable String lastName;
        private @Nullable String email;
        private @Nullable String type;
        private @Nullable String businessName;
        private @Nullable String ipAddress;
        private @Nullable String correlationId;

        private Builder() {
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder businessName(String businessName) {
            this.businessName = businessName;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public CreateCustomerRequest build() {
            return new CreateCustomerRequest(
                    Assert.checkNotNullParam("firstName", firstName),
                    Assert.checkNotNullParam("lastName", lastName),
                    Assert.checkNotNullParam("email", email),
                    type, businessName, ipAddress, correlationId);
        }
    }
}
