package tech.yump.secretmanager.secrets;

public class ConnectivityCheckNotSupportedException extends SecretManagerException {
    public ConnectivityCheckNotSupportedException(String message) {
        super(message);
    }
}
